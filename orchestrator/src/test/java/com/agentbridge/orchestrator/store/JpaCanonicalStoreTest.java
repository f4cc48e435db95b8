package com.agentbridge.orchestrator.store;

import com.agentbridge.orchestrator.canonical.CanonicalGraph;
import com.agentbridge.orchestrator.canonical.Iri;
import com.agentbridge.orchestrator.error.StoreException;
import com.agentbridge.orchestrator.model.Activity;
import com.agentbridge.orchestrator.model.Snapshot;
import com.agentbridge.orchestrator.repository.ActivityRepository;
import com.agentbridge.orchestrator.repository.SnapshotRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.agentbridge.orchestrator.canonical.Vocabulary.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaCanonicalStore.
 *
 * Repositories and the transaction manager are Mockito mocks, so these tests
 * cover version assignment, the conflict retry and error translation without
 * a database.
 */
@ExtendWith(MockitoExtension.class)
class JpaCanonicalStoreTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock SnapshotRepository         snapshots;
    @Mock ActivityRepository         activities;
    @Mock PlatformTransactionManager txManager;

    GraphCodec        codec = new GraphCodec(new ObjectMapper());
    JpaCanonicalStore store;

    @BeforeEach
    void setUp() {
        store = new JpaCanonicalStore(snapshots, activities, new TransactionTemplate(txManager), codec,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // createAgentSnapshot()
    // ------------------------------------------------------------------

    @Test
    void create_firstSnapshot_getsVersionOne() {
        when(snapshots.findMaxVersion("ada")).thenReturn(Optional.empty());

        SnapshotRef ref = store.createAgentSnapshot("ada", graph("Ada"), meta());

        assertThat(ref).isEqualTo(new SnapshotRef("ada", 1));
        ArgumentCaptor<Snapshot> saved = ArgumentCaptor.forClass(Snapshot.class);
        verify(snapshots).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getVersion()).isEqualTo(1);
        assertThat(saved.getValue().getTripleCount()).isEqualTo(2);
        assertThat(codec.decode(saved.getValue().getGraphJson())).isEqualTo(graph("Ada"));
        verify(txManager).commit(any());
    }

    @Test
    void create_versionConflict_retriesWithFreshMax() {
        when(snapshots.findMaxVersion("ada")).thenReturn(Optional.of(3), Optional.of(4));
        when(snapshots.saveAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("uq_agent_version"))
                .thenAnswer(inv -> inv.getArgument(0));

        SnapshotRef ref = store.createAgentSnapshot("ada", graph("Ada"), meta());

        assertThat(ref.version()).isEqualTo(5);
        verify(snapshots, times(2)).saveAndFlush(any());
        verify(txManager).rollback(any());
    }

    @Test
    void create_conflictTwice_throwsStoreException() {
        when(snapshots.findMaxVersion("ada")).thenReturn(Optional.of(1));
        when(snapshots.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("uq_agent_version"));

        assertThatThrownBy(() -> store.createAgentSnapshot("ada", graph("Ada"), meta()))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Version conflict")
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verify(snapshots, times(2)).saveAndFlush(any());
    }

    @Test
    void create_otherDataAccessFailure_isNotRetried() {
        when(snapshots.findMaxVersion("ada")).thenThrow(new DataRetrievalFailureException("connection reset"));

        assertThatThrownBy(() -> store.createAgentSnapshot("ada", graph("Ada"), meta()))
                .isInstanceOf(StoreException.class);
        verify(snapshots, never()).saveAndFlush(any());
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Test
    void getAgentSnapshot_decodesStoredGraph() {
        Snapshot row = new Snapshot("ada", 2, "mcp", 0.9, NOW, 2, codec.encode(graph("Ada")));
        when(snapshots.findTopByAgentIdOrderByVersionDesc("ada")).thenReturn(Optional.of(row));

        AgentSnapshot snapshot = store.getAgentSnapshot("ada", null).orElseThrow();

        assertThat(snapshot.version()).isEqualTo(2);
        assertThat(snapshot.graph()).isEqualTo(graph("Ada"));
        assertThat(snapshot.metadata()).isEqualTo(new SnapshotMetadata(NOW, "mcp", 0.9));
    }

    @Test
    void getAgentSnapshot_compactedRow_isEmpty() {
        Snapshot row = new Snapshot("ada", 1, "mcp", 0.9, NOW, 2, codec.encode(graph("Ada")));
        row.prune(NOW);
        when(snapshots.findByAgentIdAndVersion("ada", 1)).thenReturn(Optional.of(row));

        assertThat(store.getAgentSnapshot("ada", 1)).isEmpty();
    }

    @Test
    void reads_wrapDataAccessFailures() {
        when(snapshots.findByAgentIdOrderByVersionAsc("ada")).thenThrow(new DataRetrievalFailureException("down"));

        assertThatThrownBy(() -> store.getAgentHistory("ada"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("down");
    }

    // ------------------------------------------------------------------
    // Activities and compaction
    // ------------------------------------------------------------------

    @Test
    void recordTranslation_persistsLostFieldsAsJson() {
        UUID id = UUID.randomUUID();
        store.recordTranslation(new TranslationActivity(id, NOW, "ada", "mcp", "crewai", 0.8,
                List.of("role"), 12, true));

        ArgumentCaptor<Activity> saved = ArgumentCaptor.forClass(Activity.class);
        verify(activities).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(id);
        assertThat(saved.getValue().getLostFields()).isEqualTo("[\"role\"]");
    }

    @Test
    void compact_prunesRowsReturnedByQuery() {
        Snapshot a1 = new Snapshot("ada", 1, "mcp", 0.9, NOW, 2, "[]");
        Snapshot b1 = new Snapshot("bob", 1, "mcp", 0.9, NOW, 2, "[]");
        when(snapshots.findPrunable(1)).thenReturn(List.of(a1, b1));

        CompactionResult result = store.compact(new RetentionPolicy(1));

        assertThat(result.prunedSnapshots()).isEqualTo(2);
        assertThat(result.affectedAgents()).containsExactly("ada", "bob");
        assertThat(a1.isCompacted()).isTrue();
        assertThat(a1.getCompactedAt()).isEqualTo(NOW);
        verify(snapshots).saveAll(List.of(a1, b1));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static CanonicalGraph graph(String name) {
        Iri agent = agentIri("ada");
        return CanonicalGraph.builder().type(agent, AGENT).literal(agent, NAME, name).build();
    }

    static SnapshotMetadata meta() {
        return new SnapshotMetadata(NOW, "mcp", 0.95);
    }
}
