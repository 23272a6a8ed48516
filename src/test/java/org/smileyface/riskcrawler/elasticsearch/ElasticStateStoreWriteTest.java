package org.smileyface.riskcrawler.elasticsearch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.store.StoreWriteException;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Verdict writes against a mocked client, covering what the container tests cannot force: a bulk
 * request that is only partly applied.
 */
class ElasticStateStoreWriteTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String URL = "https://offers.example/win";

    private ElasticRestClient client;
    private ElasticStateStore store;

    @BeforeEach
    void setUp() {
        client = mock(ElasticRestClient.class);
        store = new ElasticStateStore(client, "unit", false);
    }

    @Test
    void historyAndTargetGoOutInOneBulkRequestWithStableIds() throws IOException {
        Target visit = Target.discovered(URL, TargetKind.PAGE, "offers.example", T0).visited(T0);
        store.recordVerdict(visit, verdict(T0));

        List<ElasticRestClient.IndexOp> ops = captureBulk(1).get(0);
        String docId = ElasticStateStore.docId(URL);
        assertThat(ops).extracting(ElasticRestClient.IndexOp::index)
                .containsExactly("unit-verdicts", "unit-targets");
        assertThat(ops).extracting(ElasticRestClient.IndexOp::id)
                .containsExactly(docId + "-1", docId);
    }

    @Test
    void retryAfterPartialFailureRewritesTheSameHistoryDocument() throws IOException {
        Target visit = Target.discovered(URL, TargetKind.PAGE, "offers.example", T0).visited(T0);
        doThrow(new IOException("Bulk write rejected [unit-targets: es_rejected_execution_exception]"))
                .doNothing()
                .when(client).bulkIndex(anyList(), anyBoolean());

        assertThatThrownBy(() -> store.recordVerdict(visit, verdict(T0)))
                .isInstanceOf(StoreWriteException.class)
                .hasMessageContaining(URL);
        store.recordVerdict(visit, verdict(T0.plusSeconds(30)));

        List<List<ElasticRestClient.IndexOp>> calls = captureBulk(2);
        assertThat(calls.get(1)).extracting(ElasticRestClient.IndexOp::id)
                .containsExactlyElementsOf(calls.get(0).stream().map(ElasticRestClient.IndexOp::id).toList());
    }

    @Test
    void nextVisitGetsItsOwnHistoryDocument() throws IOException {
        doNothing().when(client).bulkIndex(anyList(), anyBoolean());
        Target first = Target.discovered(URL, TargetKind.PAGE, "offers.example", T0).visited(T0);
        store.recordVerdict(first, verdict(T0));
        store.recordVerdict(first.visited(T0.plusSeconds(3600)), verdict(T0.plusSeconds(3600)));

        List<List<ElasticRestClient.IndexOp>> calls = captureBulk(2);
        assertThat(calls.get(0).get(0).id()).isNotEqualTo(calls.get(1).get(0).id());
        assertThat(calls.get(1).get(0).id()).endsWith("-2");
    }

    @SuppressWarnings("unchecked")
    private List<List<ElasticRestClient.IndexOp>> captureBulk(int expectedCalls) throws IOException {
        ArgumentCaptor<List<ElasticRestClient.IndexOp>> captor = ArgumentCaptor.forClass(List.class);
        verify(client, times(expectedCalls)).bulkIndex(captor.capture(), anyBoolean());
        return captor.getAllValues();
    }

    private static Verdict verdict(Instant at) {
        return new Verdict(URL, RiskLabel.FRAUD, 0.9, List.of(), null, at, "hash-1");
    }
}
