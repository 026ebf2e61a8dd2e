package de.mirkosertic.contactbench.store.lucene;

import de.mirkosertic.contactbench.plan.Pagination;
import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.schema.EntityDefinition;
import de.mirkosertic.contactbench.schema.SchemaRegistry;
import de.mirkosertic.contactbench.store.AbstractStoreQuery;
import de.mirkosertic.contactbench.store.ContactStore;
import de.mirkosertic.contactbench.store.StoreException;
import de.mirkosertic.contactbench.store.StoreQuery;
import de.mirkosertic.contactbench.store.StoreResult;
import de.mirkosertic.contactbench.store.StoreTimeoutException;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.QueryTimeout;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ContactStore} backed by a Lucene index.
 * <p>
 * Each prepared query holds a searcher reference from the {@link SearcherManager} until it is
 * closed. The statement timeout and aborts are enforced through {@link IndexSearcher#setTimeout},
 * so a long running collection stops at the next timeout check.
 */
public class LuceneContactStore implements ContactStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneContactStore.class);

    private final Directory directory;
    private final SchemaRegistry schema;
    private final IndexWriter indexWriter;
    private final SearcherManager searcherManager;
    private final LuceneQueryTranslator translator = new LuceneQueryTranslator();

    public LuceneContactStore(final Directory directory, final SchemaRegistry schema) throws IOException {
        this.directory = directory;
        this.schema = schema;
        final IndexWriterConfig config = new IndexWriterConfig();
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(directory, config);
        // Commit to ensure index files exist before the first searcher opens
        this.indexWriter.commit();
        this.searcherManager = new SearcherManager(indexWriter, null);
    }

    /**
     * Opens or creates the index at {@code path}.
     */
    public static LuceneContactStore open(final Path path, final SchemaRegistry schema) throws IOException {
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            logger.info("Created index directory: {}", path.toAbsolutePath());
        }
        final LuceneContactStore store = new LuceneContactStore(FSDirectory.open(path), schema);
        logger.info("Contact index opened at {} with {} documents", path.toAbsolutePath(),
                store.indexWriter.getDocStats().numDocs);
        return store;
    }

    public ContactIndexer indexer() {
        return new ContactIndexer(indexWriter, schema);
    }

    /**
     * Commits pending documents and makes them visible to subsequently prepared queries.
     */
    public void commit() throws IOException {
        indexWriter.commit();
        searcherManager.maybeRefreshBlocking();
    }

    /**
     * Removes every document.
     */
    public void purge() throws IOException {
        indexWriter.deleteAll();
        commit();
    }

    public long documentCount() {
        return indexWriter.getDocStats().numDocs;
    }

    @Override
    public String name() {
        return "lucene";
    }

    @Override
    public StoreQuery<StoreResult> prepareFetch(final QueryPlan plan, final Duration statementTimeout)
            throws StoreException {
        return new LuceneQuery<>(plan, statementTimeout) {
            @Override
            protected StoreResult run(final IndexSearcher searcher, final Query query) throws IOException, StoreException {
                return fetch(this, searcher, query);
            }
        };
    }

    @Override
    public StoreQuery<Long> prepareCount(final QueryPlan plan, final Duration statementTimeout) throws StoreException {
        return new LuceneQuery<>(plan, statementTimeout) {
            @Override
            protected Long run(final IndexSearcher searcher, final Query query) throws IOException, StoreException {
                statement();
                final long count = searcher.count(query);
                checkCompleted(searcher);
                return count;
            }
        };
    }

    private StoreResult fetch(final LuceneQuery<StoreResult> owner, final IndexSearcher searcher, final Query query)
            throws IOException, StoreException {
        final QueryPlan plan = owner.plan;
        final Sort sort = translator.toSort(plan.order());
        final Pagination pagination = plan.pagination();

        if (!pagination.isPaginated()) {
            owner.statement();
            final TopFieldDocs docs = searcher.search(query, Math.max(1, searcher.getIndexReader().maxDoc()), sort);
            owner.checkCompleted(searcher);
            final List<Map<String, Object>> rows = readRows(owner, searcher, docs.scoreDocs, 0);
            return new StoreResult(rows, rows.size());
        }

        owner.statement();
        final long total = searcher.count(query);
        owner.checkCompleted(searcher);
        if (pagination.offset() >= total) {
            return new StoreResult(List.of(), total);
        }

        final int topN = (int) Math.min(total, pagination.offset() + pagination.limit());
        owner.statement();
        final TopFieldDocs docs = searcher.search(query, topN, sort);
        owner.checkCompleted(searcher);
        return new StoreResult(readRows(owner, searcher, docs.scoreDocs, (int) pagination.offset()), total);
    }

    private List<Map<String, Object>> readRows(final LuceneQuery<?> owner, final IndexSearcher searcher,
                                               final ScoreDoc[] hits, final int from) throws IOException, StoreException {
        final EntityDefinition entity = schema.entity(owner.plan.entity());
        final StoredFields storedFields = searcher.storedFields();
        final List<Map<String, Object>> rows = new ArrayList<>(Math.max(0, hits.length - from));
        for (int i = from; i < hits.length; i++) {
            owner.checkCompleted(searcher);
            rows.add(LuceneFields.read(storedFields.document(hits[i].doc), entity));
        }
        return rows;
    }

    @Override
    public void close() throws StoreException {
        try {
            searcherManager.close();
            indexWriter.close();
            directory.close();
            logger.info("Contact index closed");
        } catch (final IOException e) {
            throw new StoreException("Failed to close index", e);
        }
    }

    /**
     * One prepared query with its own searcher over an acquired reader.
     */
    private abstract class LuceneQuery<T> extends AbstractStoreQuery<T> implements QueryTimeout {

        final QueryPlan plan;
        private final Duration statementTimeout;
        private final long deadlineNanos;
        private final IndexSearcher acquired;

        LuceneQuery(final QueryPlan plan, final Duration statementTimeout) throws StoreException {
            this.plan = plan;
            this.statementTimeout = statementTimeout;
            this.deadlineNanos = statementTimeout.isZero() || statementTimeout.isNegative()
                    ? Long.MAX_VALUE
                    : System.nanoTime() + statementTimeout.toNanos();
            try {
                this.acquired = searcherManager.acquire();
            } catch (final IOException e) {
                throw new StoreException("Failed to acquire searcher", e);
            }
        }

        protected abstract T run(IndexSearcher searcher, Query query) throws IOException, StoreException;

        @Override
        protected T doExecute() throws StoreException {
            final IndexSearcher searcher = new IndexSearcher(acquired.getIndexReader());
            searcher.setTimeout(this);
            try {
                return run(searcher, translator.toQuery(plan));
            } catch (final IOException e) {
                throw new StoreException("Lucene query failed: " + e.getMessage(), e);
            }
        }

        @Override
        public boolean shouldExit() {
            return isAborted() || (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0);
        }

        void statement() {
            statementIssued();
        }

        void checkCompleted(final IndexSearcher searcher) throws StoreException {
            if (isAborted()) {
                throw new StoreException("Query aborted");
            }
            if (searcher.timedOut() || shouldExit()) {
                throw new StoreTimeoutException(statementTimeout);
            }
        }

        @Override
        protected void onAbort() {
            logger.debug("Abort requested for {} query", plan.entity().parameterName());
        }

        @Override
        protected void release() {
            try {
                searcherManager.release(acquired);
            } catch (final IOException e) {
                logger.warn("Failed to release searcher", e);
            }
        }
    }
}
