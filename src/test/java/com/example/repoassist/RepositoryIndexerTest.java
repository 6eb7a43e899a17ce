package com.example.repoassist;

import com.example.repoassist.testutils.TestRepositories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.mock.env.MockEnvironment;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

public class RepositoryIndexerTest {

    @TempDir
    Path tempDir;

    private static List<String> chunkIds(RepositorySnapshot s) {
        return s.getChunks().stream().map(Chunk::getId).collect(Collectors.toList());
    }

    @Test
    public void ingestsFilesChunksAndTree() throws Exception {
        TestRepositories.authRepository(tempDir);
        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry()).ingest(tempDir);

        assertThat(s.getEpoch()).isEqualTo(1);
        assertThat(s.getId()).isEqualTo(tempDir.getFileName().toString());
        assertThat(s.totalFiles()).isEqualTo(3);
        assertThat(s.file("auth/login.py").getKind()).isEqualTo(FileKind.CODE);
        assertThat(s.file("auth/login.py").getLineCount()).isEqualTo(15);
        assertThat(s.file("README.md").getKind()).isEqualTo(FileKind.DOCS);
        assertThat(chunkIds(s)).contains("auth/login.py#L1-15");
        assertThat(s.getTree().find("auth").getFilePaths()).containsExactly("auth/login.py");
        assertThat(s.getIndex().chunksContaining("authentic")).containsExactly("auth/login.py#L1-15");
        assertThat(s.getSkipped()).isEmpty();
    }

    @Test
    public void reingestingAnUnchangedTreeIsDeterministic() throws Exception {
        TestRepositories.authRepository(tempDir);
        RepositoryIndexer indexer = TestRepositories.indexer(new IndexRegistry());

        RepositorySnapshot first = indexer.ingest(tempDir);
        RepositorySnapshot second = indexer.ingest(tempDir);

        assertThat(second.getEpoch()).isEqualTo(first.getEpoch() + 1);
        assertThat(chunkIds(second)).isEqualTo(chunkIds(first));
        assertThat(second.getIndex()).isEqualTo(first.getIndex());
    }

    @Test
    public void rangeTextMatchesTheFile() throws Exception {
        TestRepositories.authRepository(tempDir);
        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry()).ingest(tempDir);

        List<String> lines = Files.readAllLines(tempDir.resolve("auth/login.py"));
        assertThat(s.linesOf("auth/login.py", 4, 9)).isEqualTo(String.join("\n", lines.subList(3, 9)));
    }

    @Test
    public void binaryFilesAreMetadataOnly() throws Exception {
        TestRepositories.write(tempDir, "main.py", "print('hi')\n");
        Files.write(tempDir.resolve("logo.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G'});
        Files.write(tempDir.resolve("blob"), new byte[]{'x', 0, 'y'});

        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry()).ingest(tempDir);

        assertThat(s.file("logo.png").getKind()).isEqualTo(FileKind.BINARY);
        assertThat(s.file("blob").getKind()).isEqualTo(FileKind.BINARY);
        assertThat(s.file("blob").getChunkIds()).isEmpty();
        assertThat(s.chunksOf("logo.png")).isEmpty();
        assertThat(s.totalChunks()).isEqualTo(1);
    }

    @Test
    public void oversizedFilesAreSkippedWithAReason() throws Exception {
        TestRepositories.write(tempDir, "small.py", "x = 1\n");
        TestRepositories.write(tempDir, "big.py", "x = 1\n".repeat(50));
        MockEnvironment env = TestRepositories.environment().withProperty("indexer.max-file.bytes", "100");

        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry(), Mockito.mock(ReasoningEngine.class), env)
                .ingest(tempDir);

        assertThat(s.file("big.py")).isNotNull();
        assertThat(s.file("big.py").getChunkIds()).isEmpty();
        assertThat(s.getSkipped()).containsKey("big.py");
        assertThat(s.file("small.py").getChunkIds()).hasSize(1);
    }

    @Test
    public void emptyRepositoryIsValid() {
        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry()).ingest(tempDir);

        assertThat(s.totalFiles()).isZero();
        assertThat(s.totalChunks()).isZero();
        assertThat(s.getEpoch()).isEqualTo(1);
    }

    @Test
    public void cancellationStopsIngestion() throws Exception {
        TestRepositories.authRepository(tempDir);
        List<Integer> progress = new ArrayList<>();
        RepositoryIndexer indexer = TestRepositories.indexer(new IndexRegistry());

        assertThatThrownBy(() -> indexer.ingest(tempDir, () -> progress.size() >= 1, (done, total) -> progress.add(done)))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("cancelled after 1 files");
    }

    @Test
    public void tagsFilesAndDirectoriesWhenTheEngineAnswers() throws Exception {
        TestRepositories.authRepository(tempDir);
        ReasoningEngine engine = Mockito.mock(ReasoningEngine.class);
        when(engine.describe(anyList())).thenAnswer(inv -> {
            List<TagSubject> subjects = inv.getArgument(0);
            Map<String, String> tags = new LinkedHashMap<>();
            for (TagSubject t : subjects) tags.put(t.getPath(), (t.isDirectory() ? "dir " : "file ") + t.getPath());
            return tags;
        });
        MockEnvironment env = TestRepositories.environment().withProperty("indexer.tags.enabled", "true");

        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry(), engine, env).ingest(tempDir);

        assertThat(s.file("auth/login.py").getTag()).isEqualTo("file auth/login.py");
        assertThat(s.chunk("auth/login.py#L1-15").getTag()).isEqualTo("file auth/login.py");
        assertThat(s.getTree().find("auth").getTag()).isEqualTo("dir auth");
        assertThat(s.getTree().getTag()).isEqualTo("dir .");
    }

    @Test
    public void tagFailureDoesNotFailIngestion() throws Exception {
        TestRepositories.authRepository(tempDir);
        ReasoningEngine engine = Mockito.mock(ReasoningEngine.class);
        when(engine.describe(anyList())).thenThrow(new OracleException("ollama is not running"));
        MockEnvironment env = TestRepositories.environment()
                .withProperty("indexer.tags.enabled", "true")
                .withProperty("oracle.retries", "0");

        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry(), engine, env).ingest(tempDir);

        assertThat(s.totalFiles()).isEqualTo(3);
        assertThat(s.getFiles()).allSatisfy(f -> assertThat(f.getTag()).isNull());
        assertThat(s.getTree().getTag()).isNull();
    }

    @Test
    public void splitLinesIgnoresTheFinalNewline() {
        assertThat(RepositoryIndexer.splitLines("a\r\nb\n")).containsExactly("a", "b");
        assertThat(RepositoryIndexer.splitLines("a\n\n")).containsExactly("a", "");
        assertThat(RepositoryIndexer.splitLines("")).isEmpty();
    }

    @Test
    public void invalidUtf8PastTheSniffedHeadKeepsMetadata() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (int i = 1; i <= 600; i++) {
            bytes.write(("plain ascii note number " + i + "\n").getBytes(StandardCharsets.US_ASCII));
        }
        bytes.write("# caf\u00e9 au lait\n".getBytes(StandardCharsets.ISO_8859_1));
        Files.write(tempDir.resolve("notes.txt"), bytes.toByteArray());
        TestRepositories.write(tempDir, "README.md", TestRepositories.README);

        RepositorySnapshot s = TestRepositories.indexer(new IndexRegistry()).ingest(tempDir);

        SourceFile notes = s.file("notes.txt");
        assertThat(notes).isNotNull();
        assertThat(notes.getKind()).isEqualTo(FileKind.BINARY);
        assertThat(notes.getChunkIds()).isEmpty();
        assertThat(notes.getSizeBytes()).isEqualTo(bytes.size());
        assertThat(s.getSkipped()).doesNotContainKey("notes.txt");
        assertThat(s.totalFiles()).isEqualTo(2);
    }
}
