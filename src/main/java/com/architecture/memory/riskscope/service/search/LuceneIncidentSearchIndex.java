package com.architecture.memory.riskscope.service.search;

import com.architecture.memory.riskscope.model.graph.nodes.FileNode;
import com.architecture.memory.riskscope.model.graph.nodes.IncidentNode;
import com.architecture.memory.riskscope.repository.graph.IncidentNodeRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory BM25 index over incident title, description and root cause.
 *
 * <p>Readers see a consistent snapshot: a rebuild writes a fresh directory and swaps it in.
 * Each search holds a reference on its snapshot's reader; the replaced reader and its
 * directory are closed once the last in-flight search releases it.</p>
 */
@Slf4j
@Service
public class LuceneIncidentSearchIndex implements IncidentSearchIndex {

    static final String FIELD_ID = "id";
    static final String FIELD_TITLE = "title";
    static final String FIELD_TEXT = "text";
    static final String FIELD_FILE = "file";
    static final int MAX_QUERY_TERMS = 512;

    private final IncidentNodeRepository incidentNodeRepository;
    private final Analyzer analyzer = new EnglishAnalyzer();

    private volatile Snapshot snapshot;

    public LuceneIncidentSearchIndex(IncidentNodeRepository incidentNodeRepository) {
        this.incidentNodeRepository = incidentNodeRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rebuildOnStartup() {
        try {
            rebuild();
        } catch (DataAccessException e) {
            log.warn("[IncidentIndex] Could not load incidents at startup, index stays empty until the next link event: {}",
                    e.getMessage());
        }
    }

    @Override
    public void rebuild() {
        List<IncidentNode> incidents = incidentNodeRepository.findAll();
        index(incidents);
    }

    /**
     * Replaces the index contents with the given incidents.
     */
    public synchronized void index(Collection<IncidentNode> incidents) {
        Directory directory = new ByteBuffersDirectory();
        IndexWriterConfig config = new IndexWriterConfig(analyzer).setSimilarity(new BM25Similarity());
        try (IndexWriter writer = new IndexWriter(directory, config)) {
            for (IncidentNode incident : incidents) {
                writer.addDocument(toDocument(incident));
            }
            writer.commit();
            DirectoryReader reader = DirectoryReader.open(directory);
            reader.getReaderCacheHelper().addClosedListener(key -> directory.close());
            IndexSearcher searcher = new IndexSearcher(reader);
            searcher.setSimilarity(new BM25Similarity());

            Snapshot previous = snapshot;
            snapshot = new Snapshot(reader, searcher, incidents.size());
            if (previous != null) {
                previous.reader().decRef();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build incident index", e);
        }
        log.info("[IncidentIndex] Indexed {} incidents", incidents.size());
    }

    @PreDestroy
    public synchronized void close() {
        Snapshot current = snapshot;
        snapshot = null;
        if (current != null) {
            try {
                current.reader().decRef();
            } catch (IOException e) {
                log.warn("[IncidentIndex] Failed to close index reader: {}", e.getMessage());
            }
        }
    }

    @Override
    public List<IncidentMatch> search(String query, int topK, String filePath) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Set<String> terms = analyze(query);
        if (terms.isEmpty()) {
            return List.of();
        }
        Snapshot current = acquire();
        if (current == null) {
            return List.of();
        }
        try {
            return current.size() == 0 ? List.of() : search(current, terms, topK, filePath);
        } finally {
            release(current);
        }
    }

    private List<IncidentMatch> search(Snapshot current, Set<String> terms, int topK, String filePath) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        terms.forEach(t -> builder.add(new TermQuery(new Term(FIELD_TEXT, t)), BooleanClause.Occur.SHOULD));

        try {
            TopDocs top = current.searcher().search(builder.build(), topK);
            StoredFields stored = current.searcher().storedFields();
            List<IncidentMatch> matches = new ArrayList<>();
            for (ScoreDoc hit : top.scoreDocs) {
                Document doc = stored.document(hit.doc);
                boolean affects = filePath != null
                        && Arrays.asList(doc.getValues(FIELD_FILE)).contains(filePath);
                matches.add(IncidentMatch.builder()
                        .incidentId(doc.get(FIELD_ID))
                        .title(doc.get(FIELD_TITLE))
                        .score(hit.score)
                        .affectsFile(affects)
                        .build());
            }
            return matches;
        } catch (IOException e) {
            throw new UncheckedIOException("Incident search failed", e);
        }
    }

    /**
     * Takes a reference on the current reader. A reader closed by a concurrent swap is skipped
     * in favour of the snapshot that replaced it.
     */
    private Snapshot acquire() {
        while (true) {
            Snapshot current = snapshot;
            if (current == null) {
                return null;
            }
            if (current.reader().tryIncRef()) {
                return current;
            }
        }
    }

    private static void release(Snapshot current) {
        try {
            current.reader().decRef();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to release index reader", e);
        }
    }

    DirectoryReader currentReader() {
        Snapshot current = snapshot;
        return current == null ? null : current.reader();
    }

    @Override
    public int size() {
        Snapshot current = snapshot;
        return current == null ? 0 : current.size();
    }

    private Set<String> analyze(String text) {
        Set<String> terms = new LinkedHashSet<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD_TEXT, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken() && terms.size() < MAX_QUERY_TERMS) {
                terms.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to analyze query", e);
        }
        return terms;
    }

    private static Document toDocument(IncidentNode incident) {
        Document doc = new Document();
        doc.add(new StringField(FIELD_ID, incident.getId(), Field.Store.YES));
        doc.add(new StoredField(FIELD_TITLE, Objects.toString(incident.getTitle(), "")));
        String text = String.join("\n",
                Objects.toString(incident.getTitle(), ""),
                Objects.toString(incident.getDescription(), ""),
                Objects.toString(incident.getRootCause(), ""));
        doc.add(new TextField(FIELD_TEXT, text, Field.Store.NO));
        if (incident.getAffectedFiles() != null) {
            incident.getAffectedFiles().stream()
                    .map(FileNode::getPath)
                    .filter(Objects::nonNull)
                    .forEach(path -> doc.add(new StringField(FIELD_FILE, path, Field.Store.YES)));
        }
        return doc;
    }

    private record Snapshot(DirectoryReader reader, IndexSearcher searcher, int size) {
    }
}
