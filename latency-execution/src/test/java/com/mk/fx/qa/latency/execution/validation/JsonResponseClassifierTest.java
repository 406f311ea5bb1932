package com.mk.fx.qa.latency.execution.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.rest.TransportFailureKind;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonResponseClassifierTest {

  private final JsonResponseClassifier searchApi =
      new JsonResponseClassifier(ValidationRules.searchApi());

  private Classification search(int status, String body) {
    return searchApi.classify(ClassifierInput.response(status, body.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void organicResults_success() {
    Classification c =
        search(
            200,
            "{\"search_metadata\":{\"status\":\"success\"},"
                + "\"organic_results\":[{\"title\":\"Result 1\",\"link\":\"http://example.com\"}]}");
    assertTrue(c.success());
    assertNull(c.reason());
  }

  @Test
  void topLevelError_reportedAsApiError() {
    Classification c = search(200, "{\"error\":\"Invalid API key\"}");
    assertFalse(c.success());
    assertEquals(Classification.REPORTED_ERROR, c.reason());
    assertEquals(FailureCategory.VALIDATION, c.category());
    assertTrue(c.detail().contains("API Error"));
    assertTrue(c.detail().contains("Invalid API key"));
  }

  @Test
  void nonOkStatus_failsBeforeBodyInspection() {
    Classification c = search(400, "{\"search_metadata\":{\"status\":\"success\"}}");
    assertEquals("HTTP_400", c.reason());
    assertEquals(FailureCategory.HTTP_STATUS, c.category());
    assertTrue(c.describe().contains("HTTP 400"));
  }

  @Test
  void nonOkStatus_withMalformedBody_isStillHttpFailure() {
    assertEquals("HTTP_502", search(502, "<html>Bad Gateway</html>").reason());
  }

  @Test
  void missingMetadata() {
    Classification c = search(200, "{\"some_data\":\"value\"}");
    assertEquals(Classification.MISSING_METADATA, c.reason());
    assertTrue(c.detail().contains("search_metadata"));
  }

  @Test
  void jsonThatIsNotAnObject_isParseError() {
    assertEquals(Classification.PARSE_ERROR, search(200, "\"not a dictionary\"").reason());
    assertEquals(Classification.PARSE_ERROR, search(200, "[1,2,3]").reason());
    assertEquals(FailureCategory.PARSE, search(200, "[1,2,3]").category());
  }

  @Test
  void malformedOrEmptyBody_isParseError() {
    assertEquals(Classification.PARSE_ERROR, search(200, "not json").reason());
    assertEquals(Classification.PARSE_ERROR, search(200, "{\"a\":").reason());
    assertEquals(Classification.PARSE_ERROR, search(200, "").reason());
  }

  @Test
  void metadataErrorStatus_reportedAsSearchError() {
    Classification c =
        search(
            200,
            "{\"search_metadata\":{\"status\":\"error\",\"error\":\"Rate limit exceeded\"}}");
    assertEquals(Classification.REPORTED_ERROR, c.reason());
    assertTrue(c.detail().contains("Search error"));
    assertTrue(c.detail().contains("Rate limit exceeded"));
  }

  @Test
  void shoppingResults_success() {
    assertTrue(
        search(
                200,
                "{\"search_metadata\":{\"status\":\"success\"},"
                    + "\"shopping_results\":[{\"title\":\"Product 1\",\"price\":\"$99\"}]}")
            .success());
  }

  @Test
  void emptyOrganicResults_butOtherResultTypes_success() {
    assertTrue(
        search(
                200,
                "{\"search_metadata\":{\"status\":\"success\"},\"organic_results\":[],"
                    + "\"local_results\":[{\"name\":\"Local Business\"}],"
                    + "\"knowledge_graph\":{\"title\":\"Knowledge\"}}")
            .success());
  }

  @Test
  void noResultFields_andFewFields_isEmptyResult() {
    Classification c =
        search(200, "{\"search_metadata\":{\"status\":\"success\"},\"search_parameters\":{\"q\":\"test\"}}");
    assertEquals(Classification.EMPTY_RESULT, c.reason());
    assertTrue(c.detail().contains("No results found"));
  }

  @Test
  void noResultFields_butEnoughFields_success() {
    assertTrue(
        search(
                200,
                "{\"search_metadata\":{\"status\":\"success\"},\"search_parameters\":{},"
                    + "\"search_information\":{}}")
            .success());
  }

  @Test
  void topLevelError_winsOverMissingMetadata() {
    assertEquals(
        Classification.REPORTED_ERROR, search(200, "{\"error\":\"quota\",\"x\":1}").reason());
  }

  @Test
  void transportFailure_winsOverEverything() {
    Classification c =
        searchApi.classify(ClassifierInput.failure(TransportFailureKind.READ_TIMEOUT, "timed out"));
    assertEquals("READ_TIMEOUT", c.reason());
    assertEquals(FailureCategory.TRANSPORT, c.category());
  }

  @Test
  void sameInput_sameVerdict() {
    byte[] body = "{\"search_metadata\":{\"status\":\"success\"}}".getBytes(StandardCharsets.UTF_8);
    Classification first = searchApi.classify(ClassifierInput.response(200, body));
    Classification second = searchApi.classify(ClassifierInput.response(200, body));
    assertEquals(first, second);
  }

  @Test
  void statusOnly_ignoresBody() {
    var classifier = new JsonResponseClassifier(ValidationRules.statusOnly());
    assertTrue(classifier.classify(ClassifierInput.response(200, "not json".getBytes())).success());
    assertEquals("HTTP_404", classifier.classify(ClassifierInput.response(404, null)).reason());
  }

  @Test
  void jsonProfile_checksRequiredFields() {
    var classifier = new JsonResponseClassifier(ValidationRules.json(List.of("ip", "country")));
    assertTrue(
        classifier
            .classify(ClassifierInput.response(200, "{\"ip\":\"1.2.3.4\",\"country\":\"DE\"}".getBytes()))
            .success());
    Classification missing =
        classifier.classify(ClassifierInput.response(200, "{\"ip\":\"1.2.3.4\"}".getBytes()));
    assertEquals(Classification.MISSING_FIELD, missing.reason());
    assertTrue(missing.detail().contains("country"));
  }
}
