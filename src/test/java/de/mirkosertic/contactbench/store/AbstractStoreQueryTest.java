package de.mirkosertic.contactbench.store;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractStoreQueryTest {

    private static final class CountingQuery extends AbstractStoreQuery<String> {

        final AtomicInteger aborts = new AtomicInteger();
        final AtomicInteger releases = new AtomicInteger();
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch proceed = new CountDownLatch(1);
        volatile boolean blocking;

        @Override
        protected String doExecute() throws StoreException {
            statementIssued();
            started.countDown();
            if (blocking) {
                try {
                    proceed.await(5, TimeUnit.SECONDS);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                assertThat(releases.get()).as("Not released while executing").isZero();
            }
            return "done";
        }

        @Override
        protected void onAbort() {
            aborts.incrementAndGet();
        }

        @Override
        protected void release() {
            releases.incrementAndGet();
        }
    }

    @Test
    void testExecuteCountsStatements() throws StoreException {
        final CountingQuery query = new CountingQuery();

        assertThat(query.execute()).isEqualTo("done");
        assertThat(query.statementCount()).isEqualTo(1);
    }

    @Test
    void testAbortRunsOnce() {
        final CountingQuery query = new CountingQuery();

        query.abort();
        query.abort();

        assertThat(query.aborts.get()).isEqualTo(1);
    }

    @Test
    void testAbortedQueryDoesNotExecute() {
        final CountingQuery query = new CountingQuery();
        query.abort();

        assertThatThrownBy(query::execute)
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("aborted");
        assertThat(query.statementCount()).isZero();
    }

    @Test
    void testCloseReleasesOnce() {
        final CountingQuery query = new CountingQuery();

        query.close();
        query.close();

        assertThat(query.releases.get()).isEqualTo(1);
        assertThatThrownBy(query::execute).isInstanceOf(StoreException.class);
    }

    @Test
    void testCloseDuringExecutionDefersRelease() throws Exception {
        final CountingQuery query = new CountingQuery();
        query.blocking = true;
        final ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            final Future<String> result = worker.submit(query::execute);
            assertThat(query.started.await(5, TimeUnit.SECONDS)).isTrue();

            query.close();
            assertThat(query.releases.get()).isZero();

            query.proceed.countDown();
            assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("done");
            assertThat(query.releases.get()).isEqualTo(1);
        } finally {
            worker.shutdownNow();
        }
    }
}
