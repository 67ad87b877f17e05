package com.phillippitts.docingest.client;

import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;
import com.phillippitts.docingest.service.monitor.ProcessingStatus;
import com.phillippitts.docingest.service.transfer.TransferReceipt;
import com.phillippitts.docingest.service.transfer.TransferRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestDocumentApiClientTest {

    private static final String BASE = "http://backend.test";

    private MockRestServiceServer server;
    private RestDocumentApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient restClient = builder.build();
        client = new RestDocumentApiClient(restClient, restClient);
    }

    private static void json(MockRestServiceServer server, HttpMethod httpMethod, String path, String body) {
        server.expect(requestTo(BASE + path))
                .andExpect(method(httpMethod))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    @Test
    void classifyReturnsDetectedType() {
        server.expect(requestTo(BASE + "/api/documents/detect-type"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andRespond(withSuccess("{\"success\":true,\"documentType\":\"broker_viac_pdf\","
                        + "\"filename\":\"viac.pdf\"}", MediaType.APPLICATION_JSON));

        assertThat(client.classify("viac.pdf", "%PDF".getBytes(StandardCharsets.US_ASCII)))
                .isEqualTo("broker_viac_pdf");
        server.verify();
    }

    @Test
    void statusDerivesProgressFromRecordCounts() {
        json(server, HttpMethod.GET, "/api/upload-progress/u-1",
                "{\"status\":\"processing\",\"processed\":30,\"total\":120}");

        ProcessingStatus status = client.status("u-1");

        assertThat(status.state()).isEqualTo(ProcessingStatus.State.PROCESSING);
        assertThat(status.progress()).isEqualTo(25);
        assertThat(status.describe()).isEqualTo("Processing… 30/120 records");
    }

    @Test
    void statusMapsCompletedAndError() {
        json(server, HttpMethod.GET, "/api/upload-progress/u-1", "{\"status\":\"completed\",\"progress\":100}");
        json(server, HttpMethod.GET, "/api/upload-progress/u-2",
                "{\"status\":\"error\",\"message\":\"Unsupported statement layout\"}");

        assertThat(client.status("u-1").state()).isEqualTo(ProcessingStatus.State.COMPLETE);
        ProcessingStatus failed = client.status("u-2");
        assertThat(failed.state()).isEqualTo(ProcessingStatus.State.ERROR);
        assertThat(failed.message()).isEqualTo("Unsupported statement layout");
    }

    @Test
    void unauthorizedBecomesAuthFailure() {
        server.expect(requestTo(BASE + "/api/upload-progress/u-1"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.status("u-1"))
                .isInstanceOf(AuthFailureException.class)
                .satisfies(e -> assertThat(((AuthFailureException) e).getOperation()).isEqualTo("status"));
    }

    @Test
    void forbiddenBecomesAuthFailure() {
        server.expect(requestTo(BASE + "/api/documents")).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.listDocuments()).isInstanceOf(AuthFailureException.class);
    }

    @Test
    void serverErrorBecomesTransferFailureWithoutBody() {
        server.expect(requestTo(BASE + "/api/documents"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body("stack trace at /srv/app").contentType(MediaType.TEXT_PLAIN));

        assertThatThrownBy(() -> client.listDocuments())
                .isInstanceOf(TransferException.class)
                .hasMessageNotContaining("/srv/app")
                .satisfies(e -> {
                    TransferException te = (TransferException) e;
                    assertThat(te.getHttpStatus()).isEqualTo(500);
                    assertThat(te.getOperation()).isEqualTo("list");
                });
    }

    @Test
    void listMapsBackendDocuments() {
        json(server, HttpMethod.GET, "/api/documents", "{\"success\":true,\"documents\":["
                + "{\"id\":\"d1\",\"documentType\":\"bank_statement_dkb\",\"originalName\":\"jan.csv\","
                + "\"fileSize\":1200,\"documentMetadata\":{\"rows\":10}},"
                + "{\"id\":\"d2\",\"documentType\":\"broker_viac_pdf\",\"originalName\":\"depot.pdf\"}]}");

        List<KnownDocument> documents = client.listDocuments();

        assertThat(documents).containsExactly(
                new KnownDocument("d1", "jan.csv", 1200L, "bank_statement_dkb"),
                new KnownDocument("d2", "depot.pdf", null, "broker_viac_pdf"));
    }

    @Test
    void deleteByCategoryReturnsDeletedCount() {
        json(server, HttpMethod.DELETE, "/api/documents/by-type/broker_viac_pdf",
                "{\"success\":true,\"deleted_count\":4}");
        server.expect(requestTo(BASE + "/api/documents/d1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertThat(client.deleteByCategory("broker_viac_pdf")).isEqualTo(4);
        client.deleteDocument("d1");
        server.verify();
    }

    @Test
    void transferReturnsReceiptAndReportsBytes() {
        json(server, HttpMethod.POST, "/api/documents/upload", "{\"success\":true,"
                + "\"document\":{\"id\":\"d9\",\"documentType\":\"bank_statement_dkb\",\"originalName\":\"jan.csv\"},"
                + "\"importSummary\":\"Imported 12 transactions\"}");
        byte[] content = new byte[4096];
        List<Long> sent = new CopyOnWriteArrayList<>();

        TransferReceipt receipt = client.transfer(new TransferRequest("u-1", "jan.csv", content, "bank_statement_dkb"),
                (bytesSent, total) -> sent.add(bytesSent));

        assertThat(receipt.documentId()).isEqualTo("d9");
        assertThat(receipt.importSummary()).isEqualTo("Imported 12 transactions");
        assertThat(sent).isNotEmpty().isSorted();
        assertThat(sent.get(sent.size() - 1)).isEqualTo(4096L);
    }

    @Test
    void transferWithoutDocumentIdFails() {
        json(server, HttpMethod.POST, "/api/documents/upload", "{\"success\":true}");

        assertThatThrownBy(() -> client.transfer(
                new TransferRequest("u-1", "jan.csv", new byte[]{1}, "bank_statement_dkb"), (s, t) -> { }))
                .isInstanceOf(TransferException.class)
                .hasMessageContaining("no document id");
    }
}
