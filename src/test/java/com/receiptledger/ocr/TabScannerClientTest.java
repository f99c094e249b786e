package com.receiptledger.ocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.manyTimes;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.anything;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.receiptledger.config.TabScannerProperties;
import com.receiptledger.extraction.OcrDocument;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TabScannerClientTest {
  private static final String BASE_URL = "https://ocr.test";
  private static final byte[] IMAGE = {1, 2, 3};

  private MockRestServiceServer server;
  private TabScannerClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    client = new TabScannerClient(
        new TabScannerProperties("ocr-key", BASE_URL, Duration.ZERO, Duration.ZERO), builder.build());
  }

  @Test
  @DisplayName("Uploads the file, then unwraps the result payload")
  void uploadsAndFetchesResult() {
    server.expect(requestTo(BASE_URL + "/api/2/process"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("apikey", "ocr-key"))
        .andRespond(withSuccess("{\"token\":\"abc\",\"success\":true}", MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE_URL + "/api/result?token=abc"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess("{\"status\":\"done\",\"result\":{\"total\":12.5,\"establishment\":\"Kiosk\"}}",
            MediaType.APPLICATION_JSON));

    OcrDocument document = client.process(IMAGE, "receipt.jpg", "image/jpeg");

    assertThat(document.text("establishment")).contains("Kiosk");
    assertThat(document.field("total")).hasValueSatisfying(total -> assertThat(total.asDouble()).isEqualTo(12.5));
    server.verify();
  }

  @Test
  @DisplayName("Falls through result endpoints until one answers")
  void triesNextEndpointOnFailure() {
    server.expect(requestTo(BASE_URL + "/api/2/process"))
        .andRespond(withSuccess("{\"duplicate\":true,\"duplicateToken\":\"dup-1\"}", MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE_URL + "/api/result?token=dup-1")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(BASE_URL + "/api/2/result?token=dup-1")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(BASE_URL + "/api/result/dup-1"))
        .andRespond(withSuccess("{\"data\":{\"total\":3}}", MediaType.APPLICATION_JSON));

    OcrDocument document = client.process(IMAGE, "receipt.png", "image/png");

    assertThat(document.field("total")).isPresent();
    server.verify();
  }

  @Test
  @DisplayName("Posts the token to the last endpoints")
  void postsTokenWhenGetEndpointsFail() {
    server.expect(requestTo(BASE_URL + "/api/2/process"))
        .andRespond(withSuccess("{\"token\":\"t\"}", MediaType.APPLICATION_JSON));
    server.expect(requestTo(BASE_URL + "/api/result?token=t")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(BASE_URL + "/api/2/result?token=t")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(BASE_URL + "/api/result/t")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(BASE_URL + "/result/t")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(BASE_URL + "/api/result"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.token").value("t"))
        .andRespond(withSuccess("{\"total\":7}", MediaType.APPLICATION_JSON));

    assertThat(client.process(IMAGE, "r.jpg", "image/jpeg").field("total")).isPresent();
    server.verify();
  }

  @Test
  @DisplayName("Uses the upload response when no token comes back")
  void noTokenUsesUploadResponse() {
    server.expect(requestTo(BASE_URL + "/api/2/process"))
        .andRespond(withSuccess("{\"total\":9.99}", MediaType.APPLICATION_JSON));

    assertThat(client.process(IMAGE, "r.jpg", "image/jpeg").field("total")).isPresent();
    server.verify();
  }

  @Test
  @DisplayName("Fails when every result endpoint fails")
  void allEndpointsFail() {
    server.expect(requestTo(BASE_URL + "/api/2/process"))
        .andRespond(withSuccess("{\"token\":\"t\"}", MediaType.APPLICATION_JSON));
    server.expect(manyTimes(), anything()).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> client.process(IMAGE, "r.jpg", "image/jpeg"))
        .isInstanceOf(OcrProcessingException.class)
        .hasMessageContaining("any TabScanner endpoint");
  }

  @Test
  @DisplayName("Fails on an upload error")
  void uploadErrorFails() {
    server.expect(requestTo(BASE_URL + "/api/2/process")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> client.process(IMAGE, "r.jpg", "image/jpeg"))
        .isInstanceOf(OcrProcessingException.class)
        .hasMessage("OCR processing failed");
  }
}
