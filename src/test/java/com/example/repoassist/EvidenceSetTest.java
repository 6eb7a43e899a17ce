package com.example.repoassist;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EvidenceSetTest {

    static EvidenceItem chunkDraft(String path, int start, int end, double score) {
        return EvidenceItem.builder()
                .kind(EvidenceKind.CHUNK)
                .sourceRef(Chunk.idFor(path, start, end))
                .filePath(path)
                .startLine(start)
                .endLine(end)
                .displayText("text of " + path)
                .toolCallId("T1")
                .toolName(ToolName.SEARCH_REPO)
                .rank(1)
                .score(score)
                .build();
    }

    static EvidenceItem issueDraft(int number) {
        return EvidenceItem.builder()
                .kind(EvidenceKind.ISSUE)
                .sourceRef("#" + number)
                .externalNumber(number)
                .displayText("Issue #" + number)
                .toolCallId("T2")
                .toolName(ToolName.GET_ISSUE)
                .rank(1)
                .score(1.0)
                .build();
    }

    @Test
    public void assignsSequentialIdsAndTheSetEpoch() {
        EvidenceSet set = new EvidenceSet("r1", 7, new ExternalItemCache());
        List<String> ids = set.putAll(List.of(chunkDraft("a.py", 1, 10, 2.0), issueDraft(4)));

        assertThat(ids).containsExactly("E1", "E2");
        assertThat(set.get("E1").getEpoch()).isEqualTo(7);
        assertThat(set.get("E2").getKind()).isEqualTo(EvidenceKind.ISSUE);
        assertThat(set.items()).extracting(EvidenceItem::getId).containsExactly("E1", "E2");
    }

    @Test
    public void sameSourceKeepsItsFirstId() {
        EvidenceSet set = new EvidenceSet("r1", 1, new ExternalItemCache());
        set.put(chunkDraft("a.py", 1, 10, 2.0));
        EvidenceItem range = chunkDraft("a.py", 1, 10, 9.0).toBuilder().kind(EvidenceKind.FILE_RANGE).build();

        assertThat(set.put(range)).isEqualTo("E1");
        assertThat(set.size()).isEqualTo(1);
        assertThat(set.get("E1").getKind()).isEqualTo(EvidenceKind.CHUNK);
        assertThat(set.get("E1").getScore()).isEqualTo(2.0);
        assertThat(set.idForSource(EvidenceItem.spanKey("a.py", 1, 10))).isEqualTo("E1");
        assertThat(set.idForSource("issue:4")).isNull();
    }

    @Test
    public void sealedSetRejectsEverything() {
        EvidenceSet set = new EvidenceSet("r1", 1, new ExternalItemCache());
        set.put(issueDraft(1));
        set.seal();

        assertThatThrownBy(() -> set.putAll(List.of(issueDraft(2), issueDraft(3))))
                .isInstanceOf(EvidenceSetSealedException.class);
        assertThat(set.size()).isEqualTo(1);
        assertThat(set.contains("E2")).isFalse();
    }

    @Test
    public void locationsAreReadable() {
        assertThat(chunkDraft("src/auth/login.py", 10, 42, 1).location()).isEqualTo("src/auth/login.py:10-42");
        assertThat(issueDraft(12).location()).isEqualTo("issue #12");
    }
}
