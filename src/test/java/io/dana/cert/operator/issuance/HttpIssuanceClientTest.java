package io.dana.cert.operator.issuance;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParser;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.time.Duration;
import java.util.Map;

import io.dana.cert.operator.model.Certificate;
import io.dana.cert.operator.model.CertificateRequest;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import lombok.val;

import static io.dana.cert.operator.issuance.IssuanceException.Kind.PROTOCOL;
import static io.dana.cert.operator.issuance.IssuanceException.Kind.TRANSPORT;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class HttpIssuanceClientTest {
  final static private String API_ENDPOINT = "https://cert.example.com/api/v1/certificates/";
  final static private String DOWNLOAD_ENDPOINT = "/download/";
  final static private String GUID = "83729jsdjd92819w1yhdsduy288yhduwdbd";
  final static private Duration TIMEOUT = Duration.ofSeconds(30);

  @Mock
  private HttpTransport transport;

  @Captor
  private ArgumentCaptor<Map<String, String>> headers;

  private HttpIssuanceClient client;
  private Certificate certificate;

  @Before
  public void setUp() {
    client = HttpIssuanceClient.builder()
        .transport(transport)
        .apiEndpoint(API_ENDPOINT)
        .downloadEndpoint(DOWNLOAD_ENDPOINT)
        .token("t0ken")
        .timeout(TIMEOUT)
        .skipTlsVerify(true)
        .build();

    certificate = new Certificate();
    certificate.setMetadata(new ObjectMetaBuilder().withName("web").withNamespace("default").build());
    val data = certificate.getSpec().getCertificateData();
    data.getSubject().setCommonName("web.example.com");
    data.getSubject().setOrganizationUnit("Platform");
    data.getSan().setDns(ImmutableList.of("web.example.com", "www.example.com"));
    data.setTemplate("webserver");
    data.setForm("pfx");
    certificate.getStatus().setGuid(GUID);
  }

  @Test
  public void testIssuePostsRequest() {
    when(transport.send(eq("POST"), eq(API_ENDPOINT), anyString(), anyMap(), eq(true), eq(TIMEOUT)))
        .thenReturn("{\"taskId\":\"" + GUID + "\"}");

    assertEquals(GUID, client.issue(certificate));

    val body = ArgumentCaptor.forClass(String.class);
    verify(transport).send(eq("POST"), eq(API_ENDPOINT), body.capture(), headers.capture(),
        eq(true), eq(TIMEOUT));

    val json = JsonParser.parseString(body.getValue()).getAsJsonObject();
    assertEquals("web.example.com",
        json.getAsJsonObject("subject").get("commonName").getAsString());
    assertEquals("Platform",
        json.getAsJsonObject("subject").get("organizationalUnit").getAsString());
    assertEquals(2, json.getAsJsonObject("san").getAsJsonArray("dns").size());
    assertEquals("webserver", json.get("template").getAsString());

    assertEquals("Bearer t0ken", headers.getValue().get("Authorization"));
    assertEquals("application/json", headers.getValue().get("Accept"));
  }

  @Test
  public void testIssueFailureIsPrefixed() {
    when(transport.send(eq("POST"), anyString(), anyString(), anyMap(), anyBoolean(), any()))
        .thenThrow(new IssuanceException(TRANSPORT, "connection refused"));

    val e = assertThrows(IssuanceException.class, () -> client.issue(certificate));
    assertEquals("POST to cert failed: connection refused", e.getMessage());
    assertEquals(TRANSPORT, e.getKind());
  }

  @Test
  public void testFetchValidity() {
    when(transport.send(eq("GET"), eq(API_ENDPOINT + GUID), anyString(), anyMap(), eq(true),
        eq(TIMEOUT)))
        .thenReturn("{\"validTo\":\"2024-10-18T09:05:22\",\"validFrom\":\"2024-04-18T09:05:22\","
            + "\"signatureHashAlgorithm\":\"sha384\"}");

    val validity = client.fetchValidity(certificate);

    assertEquals("2024-10-18T09:05:22", validity.getValidTo());
    assertEquals("2024-04-18T09:05:22", validity.getValidFrom());
    assertEquals("sha384", validity.getSignatureHashAlgorithm());
  }

  @Test
  public void testFetchValidityNotFound() {
    when(transport.send(eq("GET"), anyString(), anyString(), anyMap(), anyBoolean(), any()))
        .thenThrow(new IssuanceException(PROTOCOL, "Not Found"));

    val e = assertThrows(IssuanceException.class, () -> client.fetchValidity(certificate));
    assertEquals("GET request to Cert API failed: Not Found", e.getMessage());
    assertEquals(PROTOCOL, e.getKind());
  }

  @Test
  public void testDownload() {
    val url = API_ENDPOINT + GUID + DOWNLOAD_ENDPOINT + "pfx";
    when(transport.send(eq("GET"), eq(url), anyString(), anyMap(), eq(true), eq(TIMEOUT)))
        .thenReturn("{\"form\":\"pfx\",\"format\":\"pkcs12\",\"data\":\"TUlJ\","
            + "\"password\":\"pw\"}");

    val archive = client.download(certificate);

    assertEquals("pfx", archive.getForm());
    assertEquals("TUlJ", archive.getData());
    assertEquals("pw", archive.getPassword());
  }

  @Test
  public void testBodyIsNotJson() {
    when(transport.send(eq("GET"), anyString(), anyString(), anyMap(), anyBoolean(), any()))
        .thenReturn("<html>maintenance</html>");

    val e = assertThrows(IssuanceException.class, () -> client.download(certificate));
    assertEquals("failed to unmarshal response body: response body is not JSON",
        e.getMessage());
    assertEquals(PROTOCOL, e.getKind());
  }

  @Test
  public void testIsJsonObject() {
    assertTrue(HttpIssuanceClient.isJsonObject("{\"taskId\":\"1\"}"));
    assertTrue(HttpIssuanceClient.isJsonObject("{}"));
    assertFalse(HttpIssuanceClient.isJsonObject("[1, 2]"));
    assertFalse(HttpIssuanceClient.isJsonObject("\"text\""));
    assertFalse(HttpIssuanceClient.isJsonObject("{broken"));
    assertFalse(HttpIssuanceClient.isJsonObject("{taskId = abc}"));
    assertFalse(HttpIssuanceClient.isJsonObject("{'taskId':'x'}"));
    assertFalse(HttpIssuanceClient.isJsonObject("{\"taskId\":\"1\"} trailing"));
    assertFalse(HttpIssuanceClient.isJsonObject(""));
    assertFalse(HttpIssuanceClient.isJsonObject(null));
  }

  @Test
  public void testUnquotedBodyIsNotJson() {
    when(transport.send(eq("POST"), anyString(), anyString(), anyMap(), anyBoolean(), any()))
        .thenReturn("{taskId = abc}");

    val e = assertThrows(IssuanceException.class, () -> client.issue(certificate));
    assertEquals("failed to unmarshal response body: response body is not JSON",
        e.getMessage());
    assertEquals(PROTOCOL, e.getKind());
  }

  @Test
  public void testUnbindableBody() {
    val e = assertThrows(IssuanceException.class,
        () -> HttpIssuanceClient.parseResponseBody("{\"san\":{\"dns\":5}}",
            CertificateRequest.class));
    assertEquals(PROTOCOL, e.getKind());
    assertThat(e.getMessage(), startsWith("failed to unmarshal response body: "));
  }
}
