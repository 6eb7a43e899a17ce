package com.example.repoassist;

import com.example.repoassist.testutils.TestRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EvidenceStoreTest {

    @TempDir
    Path tempDir;

    private IndexRegistry registry;
    private RepositoryIndexer indexer;
    private EvidenceStore store;

    @BeforeEach
    public void setUp() throws Exception {
        TestRepositories.authRepository(tempDir);
        registry = new IndexRegistry();
        indexer = TestRepositories.indexer(registry);
        registry.publish(indexer.ingest(tempDir));
        store = new EvidenceStore(registry);
    }

    @Test
    public void resolvesChunksAndRangesOnTheCurrentEpoch() {
        ExternalItemCache cache = new ExternalItemCache();
        EvidenceSet set = store.open("r1", registry.current(), cache);
        set.put(EvidenceSetTest.chunkDraft("auth/login.py", 1, 15, 3.0));
        set.put(EvidenceSetTest.chunkDraft("auth/login.py", 4, 5, 3.0).toBuilder().kind(EvidenceKind.FILE_RANGE).build());

        assertThat(store.resolveSource(set, "E1")).isInstanceOf(Chunk.class);
        assertThat((String) store.resolveSource(set, "E2")).startsWith("def authenticate(user, password):");
    }

    @Test
    public void resolvesIssuesFromTheSessionCache() {
        ExternalItemCache cache = new ExternalItemCache();
        ExternalQuery q = new ExternalQuery("", ExternalQuery.StateFilter.OPEN, List.of(), 5);
        cache.storeIssues(q, List.of(Issue.builder().number(4).title("Login fails").state(ItemState.OPEN).build()));
        EvidenceSet set = store.open("r1", registry.current(), cache);
        set.put(EvidenceSetTest.issueDraft(4));
        set.put(EvidenceSetTest.issueDraft(5));

        assertThat(((Issue) store.resolveSource(set, "E1")).getTitle()).isEqualTo("Login fails");
        assertThatThrownBy(() -> store.resolveSource(set, "E2")).isInstanceOf(EvidenceNotFoundException.class);
    }

    @Test
    public void unknownIdIsNotFound() {
        EvidenceSet set = store.open("r1", registry.current(), new ExternalItemCache());
        assertThatThrownBy(() -> store.get(set, "E9"))
                .isInstanceOf(EvidenceNotFoundException.class)
                .hasMessageContaining("E9");
    }

    @Test
    public void evidenceFromAnOlderEpochIsStale() {
        EvidenceSet set = store.open("r1", registry.current(), new ExternalItemCache());
        set.put(EvidenceSetTest.chunkDraft("auth/login.py", 1, 15, 3.0));

        registry.publish(indexer.ingest(tempDir));

        assertThatThrownBy(() -> store.resolveSource(set, "E1"))
                .isInstanceOfSatisfying(CitationStaleException.class, e -> {
                    assertThat(e.getCitedEpoch()).isEqualTo(1);
                    assertThat(e.getCurrentEpoch()).isEqualTo(2);
                });
    }
}
