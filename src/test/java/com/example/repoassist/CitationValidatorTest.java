package com.example.repoassist;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CitationValidatorTest {

    private static final Pattern ID = Pattern.compile("E\\d+");

    private IndexRegistry registry;
    private ExternalItemCache cache;
    private CitationValidator validator;

    @BeforeEach
    public void setUp() {
        registry = new IndexRegistry();
        cache = new ExternalItemCache();
        List<Issue> issues = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            issues.add(Issue.builder().number(i).title("issue " + i).state(ItemState.OPEN).build());
        }
        cache.storeIssues(new ExternalQuery("", ExternalQuery.StateFilter.ALL, List.of(), 20), issues);
        validator = new CitationValidator(new EvidenceStore(registry));
    }

    private EvidenceSet setOf(int items) {
        EvidenceSet set = new EvidenceSet("r1", registry.current().getEpoch(), cache);
        for (int i = 1; i <= items; i++) set.put(EvidenceSetTest.issueDraft(i));
        return set;
    }

    @Test
    public void keepsKnownCitationsInFirstAppearanceOrder() {
        CitationValidator.Result r = validator.validate("Login breaks [E2]. It was reported twice [E1][E2].", setOf(3));

        assertThat(r.getCitations()).containsExactly("E2", "E1");
        assertThat(r.getStripped()).isEmpty();
        assertThat(r.getText()).isEqualTo("Login breaks [E2]. It was reported twice [E1][E2].");
    }

    @Test
    public void stripsUnknownIdsAndTidiesTheText() {
        CitationValidator.Result r = validator.validate("See the handler [E1]. Also the cache [E9].", setOf(2));

        assertThat(r.getCitations()).containsExactly("E1");
        assertThat(r.getStripped()).containsExactly("E9");
        assertThat(r.getText()).isEqualTo("See the handler [E1]. Also the cache.");
    }

    @Test
    public void multiIdMarkersKeepTheirValidIds() {
        CitationValidator.Result r = validator.validate("Both apply [E1, E7, E2 ,E1].", setOf(2));

        assertThat(r.getText()).isEqualTo("Both apply [E1, E2].");
        assertThat(r.getCitations()).containsExactly("E1", "E2");
        assertThat(r.getStripped()).containsExactly("E7");
    }

    @Test
    public void itemsWhoseSourceIsGoneAreStripped() {
        EvidenceSet set = setOf(1);
        set.put(EvidenceSetTest.issueDraft(99));

        CitationValidator.Result r = validator.validate("Old report [E2].", set);

        assertThat(r.getCitations()).isEmpty();
        assertThat(r.getStripped()).containsExactly("E2");
    }

    @Test
    public void staleEvidenceIsRejected() {
        EvidenceSet set = setOf(1);
        registry.publish(new RepositorySnapshot("demo", "/tmp/demo", 1, Instant.now(), List.of(), List.of(),
                DirectoryNode.build(List.of()), LexicalIndex.builder().build(), Map.of()));

        assertThatThrownBy(() -> validator.validate("Stale [E1].", set)).isInstanceOf(CitationStaleException.class);
    }

    @Test
    public void noAnswerCitesAnythingOutsideItsEvidence() {
        Random rnd = new Random(20240611L);
        for (int trial = 0; trial < 300; trial++) {
            int size = rnd.nextInt(8);
            EvidenceSet set = setOf(size);
            StringBuilder answer = new StringBuilder();
            Set<String> citedValid = new LinkedHashSet<>();
            int sentences = 1 + rnd.nextInt(5);
            for (int s = 0; s < sentences; s++) {
                answer.append("Claim ").append(s);
                int ids = rnd.nextInt(4);
                if (ids > 0) {
                    List<String> marker = new ArrayList<>();
                    for (int k = 0; k < ids; k++) {
                        String id = "E" + (1 + rnd.nextInt(12));
                        marker.add(id);
                        if (set.contains(id)) citedValid.add(id);
                    }
                    answer.append(" [").append(String.join(", ", marker)).append("]");
                }
                answer.append(". ");
            }

            CitationValidator.Result r = validator.validate(answer.toString(), set);

            assertThat(r.getCitations()).allMatch(set::contains);
            assertThat(r.getStripped()).noneMatch(set::contains);
            assertThat(new LinkedHashSet<>(r.getCitations())).isEqualTo(citedValid);
            Matcher m = CitationValidator.MARKER.matcher(r.getText());
            while (m.find()) {
                Matcher ids = ID.matcher(m.group(1));
                while (ids.find()) assertThat(set.contains(ids.group())).isTrue();
            }
        }
    }
}
