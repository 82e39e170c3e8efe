package dev.asclepius.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class MultimodalEmbeddingClientTest {

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestBodyUriSpec requestBodyUriSpec;

  @Mock private RestClient.RequestBodySpec requestBodySpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  private MultimodalEmbeddingClient client;

  @BeforeEach
  void setUp() {
    var properties =
        new MultimodalEmbeddingProperties(
            "http://localhost:9000",
            "nvidia/nvclip",
            "",
            3,
            1000,
            1000,
            new MultimodalEmbeddingProperties.Retry(2, 10, 2.0));
    client = new MultimodalEmbeddingClient(restClient, properties);
  }

  private void stubRestClientChain() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/v1/embeddings")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(EmbeddingApiRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenReturn(responseSpec);
  }

  private void respondWith(List<Double> embedding) {
    when(responseSpec.body(EmbeddingApiResponse.class))
        .thenReturn(new EmbeddingApiResponse(List.of(new EmbeddingApiResponse.Item(0, embedding))));
  }

  @Test
  void embedTextReturnsVectorFromFirstItem() {
    stubRestClientChain();
    respondWith(List.of(0.1, 0.2, 0.3));

    float[] vector = client.embedText("pleural effusion");

    assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f);
  }

  @Test
  void embedTextSendsModelAndFloatEncoding() {
    stubRestClientChain();
    respondWith(List.of(0.1, 0.2, 0.3));

    client.embedText("pleural effusion");

    ArgumentCaptor<EmbeddingApiRequest> captor = ArgumentCaptor.forClass(EmbeddingApiRequest.class);
    verify(requestBodySpec).body(captor.capture());
    assertThat(captor.getValue().input()).containsExactly("pleural effusion");
    assertThat(captor.getValue().model()).isEqualTo("nvidia/nvclip");
    assertThat(captor.getValue().encodingFormat()).isEqualTo("float");
  }

  @Test
  void embedImageSendsBase64DataUri() {
    stubRestClientChain();
    respondWith(List.of(0.5, 0.5, 0.5));

    client.embedImage(new byte[] {1, 2, 3}, "image/jpeg");

    ArgumentCaptor<EmbeddingApiRequest> captor = ArgumentCaptor.forClass(EmbeddingApiRequest.class);
    verify(requestBodySpec).body(captor.capture());
    assertThat(captor.getValue().input()).containsExactly("data:image/jpeg;base64,AQID");
  }

  @Test
  void emptyResponseIsUnavailable() {
    stubRestClientChain();
    when(responseSpec.body(EmbeddingApiResponse.class))
        .thenReturn(new EmbeddingApiResponse(List.of()));

    assertThatThrownBy(() -> client.embedText("q"))
        .isInstanceOf(CapabilityUnavailableException.class)
        .satisfies(
            e ->
                assertThat(((CapabilityUnavailableException) e).getCapability())
                    .isEqualTo(Capability.MULTIMODAL_EMBEDDING));
  }

  @Test
  void nullBodyIsUnavailable() {
    stubRestClientChain();
    when(responseSpec.body(EmbeddingApiResponse.class)).thenReturn(null);

    assertThatThrownBy(() -> client.embedText("q"))
        .isInstanceOf(CapabilityUnavailableException.class);
  }

  @Test
  void wrongDimensionIsUnavailable() {
    stubRestClientChain();
    respondWith(List.of(0.1, 0.2));

    assertThatThrownBy(() -> client.embedText("q"))
        .isInstanceOf(CapabilityUnavailableException.class)
        .hasMessageContaining("2 dimensions, expected 3");
  }

  @Test
  void zeroVectorIsUnavailable() {
    stubRestClientChain();
    respondWith(List.of(0.0, 0.0, 0.0));

    assertThatThrownBy(() -> client.embedText("q"))
        .isInstanceOf(CapabilityUnavailableException.class)
        .hasMessageContaining("zero vector");
  }

  @Test
  void transportErrorPropagatesForRetry() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/v1/embeddings")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(EmbeddingApiRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenThrow(new ResourceAccessException("Connection refused"));

    assertThatThrownBy(() -> client.embedText("q")).isInstanceOf(ResourceAccessException.class);
  }

  @Test
  void recoverTurnsTransportErrorIntoUnavailableCapability() {
    assertThatThrownBy(() -> client.recover(new ResourceAccessException("Connection refused")))
        .isInstanceOf(CapabilityUnavailableException.class)
        .hasMessageContaining("Connection refused");
  }

  @Test
  void dimensionComesFromProperties() {
    assertThat(client.dimension()).isEqualTo(3);
  }
}
