package imagecorpus.reorganizer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.MultiTerms;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SourceIndex} kept in a Lucene index under a temporary directory, for source trees too large
 * to hold on the heap. One document per file: the bare name as an exact-match term, the absolute path
 * as a stored field. Duplicates are all written; the tie-break is applied at lookup time and
 * collisions are counted from term document frequencies once writing is finished.
 * <p>
 * {@link #close()} deletes the temporary directory.
 */
final class SpilledSourceIndex implements SourceIndex {

    private static final Logger log = LoggerFactory.getLogger(SpilledSourceIndex.class);

    static final String NAME_FIELD = "name";
    static final String PATH_FIELD = "path";

    private static final double RAM_BUFFER_MB = 64;

    private final Path tempDir;
    private final FSDirectory directory;
    private IndexWriter writer;
    private DirectoryReader reader;
    private IndexSearcher searcher;
    private long filesSeen;
    private long heapCollisions;
    private long distinctNames;
    private long collisions;

    private SpilledSourceIndex(Path tempDir) throws IOException {
        this.tempDir = tempDir;
        this.directory = FSDirectory.open(tempDir);
        IndexWriterConfig iwc = new IndexWriterConfig();
        iwc.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        iwc.setRAMBufferSizeMB(RAM_BUFFER_MB);
        this.writer = new IndexWriter(directory, iwc);
    }

    /**
     * Create an empty, writable index in a fresh temporary directory.
     *
     * @param tempParent where to create the temporary directory; null for the system default
     */
    static SpilledSourceIndex create(Path tempParent) throws IOException {
        Path dir = tempParent == null
            ? Files.createTempDirectory("source-index-")
            : Files.createTempDirectory(Files.createDirectories(tempParent), "source-index-");
        try {
            return new SpilledSourceIndex(dir);
        } catch (IOException e) {
            deleteRecursively(dir);
            throw e;
        }
    }

    /** Move everything an in-memory index has collected so far into this one. */
    void absorb(InMemorySourceIndex heap) throws IOException {
        for (Map.Entry<String, Path> e : heap.entries().entrySet()) {
            writer.addDocument(toDocument(e.getKey(), e.getValue()));
        }
        filesSeen += heap.getFilesSeen();
        heapCollisions += heap.getCollisions();
        heap.close();
    }

    void add(Path file) throws IOException {
        ensureWritable();
        filesSeen++;
        writer.addDocument(toDocument(file.getFileName().toString(), file));
    }

    private static Document toDocument(String name, Path file) {
        Document doc = new Document();
        doc.add(new StringField(NAME_FIELD, name, Field.Store.NO));
        doc.add(new StoredField(PATH_FIELD, file.toString()));
        return doc;
    }

    /** Commit, switch to searching and compute collision counts. No more adds after this. */
    void finish() throws IOException {
        ensureWritable();
        writer.commit();
        writer.close();
        writer = null;
        reader = DirectoryReader.open(directory);
        searcher = new IndexSearcher(reader);

        long names = 0;
        long shadowed = 0;
        Terms terms = MultiTerms.getTerms(reader, NAME_FIELD);
        if (terms != null) {
            TermsEnum te = terms.iterator();
            while (te.next() != null) {
                names++;
                int docFreq = te.docFreq();
                if (docFreq > 1) {
                    shadowed += docFreq - 1;
                    log.warn("Duplicate file name {} ({} files); keeping the smallest path",
                        te.term().utf8ToString(), docFreq);
                }
            }
        }
        distinctNames = names;
        collisions = heapCollisions + shadowed;
        log.info("Spilled source index ready: {} files, {} names, {} collisions at {}",
            filesSeen, distinctNames, collisions, tempDir);
    }

    private void ensureWritable() {
        if (writer == null) {
            throw new IllegalStateException("Source index is no longer writable");
        }
    }

    @Override
    public Path lookup(String filename) throws IOException {
        if (searcher == null) {
            throw new IllegalStateException("Source index has not been finished");
        }
        TermQuery query = new TermQuery(new Term(NAME_FIELD, filename));
        int hits = searcher.count(query);
        if (hits == 0) {
            return null;
        }
        TopDocs top = searcher.search(query, hits);
        StoredFields stored = searcher.storedFields();
        Path best = null;
        for (ScoreDoc sd : top.scoreDocs) {
            Path candidate = Path.of(stored.document(sd.doc).get(PATH_FIELD));
            if (best == null || SourceIndex.wins(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    @Override
    public long getFilesSeen() { return filesSeen; }

    @Override
    public long getDistinctNames() { return distinctNames; }

    @Override
    public long getCollisions() { return collisions; }

    @Override
    public boolean isSpilled() { return true; }

    Path getTempDir() { return tempDir; }

    @Override
    public void close() throws IOException {
        try {
            if (writer != null) {
                writer.rollback();
                writer = null;
            }
            if (reader != null) {
                reader.close();
                reader = null;
            }
            directory.close();
        } finally {
            deleteRecursively(tempDir);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
