package com.receiptledger.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.receiptledger.config.OpenAiProperties;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OpenAiClientTest {
  private static final String BASE_URL = "https://openai.test";
  private static final OpenAiProperties ENABLED =
      new OpenAiProperties("sk-test", BASE_URL, null, null, null, Duration.ofSeconds(5));

  private MockRestServiceServer server;

  private OpenAiClient client(OpenAiProperties properties) {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    return new OpenAiClient(properties, builder.build(), new SimpleAsyncTaskExecutor("openai-test-"));
  }

  @Test
  @DisplayName("Sends a chat completion request and returns the message content")
  void returnsMessageContent() {
    OpenAiClient client = client(ENABLED);
    server.expect(requestTo(BASE_URL + "/v1/chat/completions"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
        .andExpect(jsonPath("$.model").value("gpt-4"))
        .andExpect(jsonPath("$.temperature").value(0.1))
        .andExpect(jsonPath("$.messages[0].role").value("system"))
        .andExpect(jsonPath("$.messages[1].content").value("receipt data"))
        .andRespond(withSuccess(
            "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"entries\\\":[]}\"}}]}",
            MediaType.APPLICATION_JSON));

    assertThat(client.complete("system", "receipt data")).isEqualTo("{\"entries\":[]}");
    server.verify();
  }

  @Test
  @DisplayName("Uses the configured model name")
  void usesConfiguredModel() {
    OpenAiClient client = client(new OpenAiProperties("sk-test", BASE_URL, "gpt-4o-mini", true, 0.0, null));
    server.expect(requestTo(BASE_URL + "/v1/chat/completions"))
        .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
        .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}", MediaType.APPLICATION_JSON));

    assertThat(client.complete("s", "u")).isEqualTo("ok");
  }

  @Test
  @DisplayName("Maps a server error to a generation failure")
  void serverErrorFails() {
    OpenAiClient client = client(ENABLED);
    server.expect(requestTo(BASE_URL + "/v1/chat/completions")).andRespond(withServerError());

    assertThatThrownBy(() -> client.complete("s", "u"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("500");
  }

  @Test
  @DisplayName("Maps a timeout to a generation failure")
  void timeoutFails() {
    OpenAiClient client = client(ENABLED);
    server.expect(requestTo(BASE_URL + "/v1/chat/completions"))
        .andRespond(withException(new SocketTimeoutException("Read timed out")));

    assertThatThrownBy(() -> client.complete("s", "u"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("unreachable");
  }

  @Test
  @DisplayName("Gives up on a response that takes longer than the timeout overall")
  void slowResponseHitsTotalDeadline() {
    OpenAiClient client = client(new OpenAiProperties("sk-test", BASE_URL, null, null, null, Duration.ofMillis(200)));
    server.expect(requestTo(BASE_URL + "/v1/chat/completions"))
        .andRespond(request -> {
          try {
            Thread.sleep(1_000);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
          return withSuccess(
              "{\"choices\":[{\"message\":{\"content\":\"late\"}}]}", MediaType.APPLICATION_JSON)
              .createResponse(request);
        });

    assertThatThrownBy(() -> client.complete("s", "u"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("exceeded 200 ms");
  }

  @Test
  @DisplayName("Rejects a response without message content")
  void missingContentFails() {
    OpenAiClient client = client(ENABLED);
    server.expect(requestTo(BASE_URL + "/v1/chat/completions"))
        .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.complete("s", "u"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("no message content");
  }

  @Test
  @DisplayName("Does not call out when disabled or without a key")
  void unavailableWithoutKey() {
    OpenAiClient noKey = client(new OpenAiProperties("  ", BASE_URL, null, null, null, null));
    OpenAiClient disabled = new OpenAiClient(
        new OpenAiProperties("sk-test", BASE_URL, null, false, null, null), RestClient.create(), Runnable::run);

    assertThat(noKey.isAvailable()).isFalse();
    assertThat(disabled.isAvailable()).isFalse();
    assertThatThrownBy(() -> disabled.complete("s", "u")).isInstanceOf(GenerationException.class);
    server.verify();
  }
}
