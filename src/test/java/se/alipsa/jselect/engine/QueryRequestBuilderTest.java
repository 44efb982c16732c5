package se.alipsa.jselect.engine;

import static org.junit.jupiter.api.Assertions.*;
import static se.alipsa.jselect.model.Predicates.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.ConfigurationException;
import se.alipsa.jselect.JSelectOptions;
import se.alipsa.jselect.UnknownColumnException;
import se.alipsa.jselect.UnsupportedPredicateException;
import se.alipsa.jselect.model.Field;
import se.alipsa.jselect.model.FieldType;
import se.alipsa.jselect.model.Schema;
import se.alipsa.jselect.request.CompressionType;
import se.alipsa.jselect.request.HeaderInfo;
import se.alipsa.jselect.request.ObjectLocation;
import se.alipsa.jselect.request.SelectRequest;

class QueryRequestBuilderTest {

  private static final ObjectLocation LOCATION = ObjectLocation.parse("s3://bucket/data/people.csv");
  private static final Schema PEOPLE = Schema.of(
      Field.required("id", FieldType.INT32),
      Field.nullable("name", FieldType.STRING),
      Field.nullable("age", FieldType.INT32),
      Field.nullable("active", FieldType.BOOLEAN));

  private static JSelectOptions options(String... keyValues) {
    Map<String, String> params = new HashMap<>();
    params.put("endpoint", "http://localhost:9000");
    for (int i = 0; i < keyValues.length; i += 2) {
      params.put(keyValues[i], keyValues[i + 1]);
    }
    return JSelectOptions.parse(params);
  }

  @Test
  void buildsCompleteRequest() {
    PreparedQuery prepared = QueryRequestBuilder.build(options(), LOCATION, PEOPLE, List.of("name"),
        List.of(gt("age", 30)));
    SelectRequest request = prepared.request();
    assertEquals("SELECT s.\"name\" FROM S3Object s WHERE CAST(NULLIF(s.\"age\", '') AS INT) > 30",
        request.expression());
    assertEquals("SQL", request.expressionType());
    assertEquals("bucket", request.bucket());
    assertEquals("data/people.csv", request.key());
    assertEquals(HeaderInfo.USE, request.input().headerInfo());
    assertEquals(',', request.input().fieldDelimiter());
    assertEquals('\n', request.input().recordDelimiter());
    assertEquals(CompressionType.NONE, request.compression());
    assertEquals(',', request.output().fieldDelimiter());
    assertEquals('\n', request.output().recordDelimiter());
    assertEquals(List.of("name"), prepared.schema().fieldNames());
    assertEquals(prepared.schema(), prepared.decodeSchema());
    assertTrue(prepared.pushdown().complete());
  }

  @Test
  void noColumnsSelectsEveryField() {
    PreparedQuery prepared = QueryRequestBuilder.build(options(), LOCATION, PEOPLE, null, null);
    assertEquals("SELECT s.\"id\", s.\"name\", s.\"age\", s.\"active\" FROM S3Object s",
        prepared.request().expression());
    assertEquals(PEOPLE, prepared.schema());
  }

  @Test
  void residualColumnsWidenTheDecodeSchema() {
    PreparedQuery prepared = QueryRequestBuilder.build(options(), LOCATION, PEOPLE, List.of("name"),
        List.of(gt("active", false), gt("age", 30)));
    assertEquals(List.of(gt("active", false)), prepared.residual());
    assertEquals(List.of("name"), prepared.schema().fieldNames());
    assertEquals(List.of("name", "active"), prepared.decodeSchema().fieldNames());
    assertEquals("SELECT s.\"name\", s.\"active\" FROM S3Object s WHERE CAST(NULLIF(s.\"age\", '') AS INT) > 30",
        prepared.request().expression());
  }

  @Test
  void withoutLocalFilterResidualIsOnlyReported() {
    PreparedQuery prepared = QueryRequestBuilder.build(options("local_filter", "false"), LOCATION, PEOPLE,
        List.of("name"), List.of(gt("active", false)));
    assertEquals(List.of(gt("active", false)), prepared.residual());
    assertEquals(prepared.schema(), prepared.decodeSchema());
    assertEquals("SELECT s.\"name\" FROM S3Object s", prepared.request().expression());
  }

  @Test
  void residualThatCannotBeEvaluatedLocallyFailsAtPlanTime() {
    UnsupportedPredicateException e = assertThrows(UnsupportedPredicateException.class,
        () -> QueryRequestBuilder.build(options(), LOCATION, PEOPLE, List.of("name"),
            List.of(gt("age", 30), eq("age", "thirty"))));
    assertEquals(eq("age", "thirty"), e.predicate());
    assertThrows(UnsupportedPredicateException.class,
        () -> QueryRequestBuilder.build(options(), LOCATION, PEOPLE, List.of("name"),
            List.of(or(isNull("name"), eq("age", "thirty")))));
  }

  @Test
  void withoutLocalFilterUnevaluableResidualIsReported() {
    PreparedQuery prepared = QueryRequestBuilder.build(options("local_filter", "false"), LOCATION, PEOPLE,
        List.of("name"), List.of(eq("age", "thirty")));
    assertEquals(List.of(eq("age", "thirty")), prepared.residual());
    assertEquals("SELECT s.\"name\" FROM S3Object s", prepared.request().expression());
  }

  @Test
  void headerlessObjectsUsePositions() {
    PreparedQuery prepared = QueryRequestBuilder.build(options("header", "false"), LOCATION, PEOPLE,
        List.of("name"), List.of(eq("id", 7)));
    assertEquals("SELECT s._2 FROM S3Object s WHERE CAST(NULLIF(s._1, '') AS INT) = 7",
        prepared.request().expression());
    assertEquals(HeaderInfo.NONE, prepared.request().input().headerInfo());
  }

  @Test
  void carriesCompressionAndDelimiter() {
    PreparedQuery prepared = QueryRequestBuilder.build(options("compression", "GZIP", "delimiter", ";"),
        LOCATION, PEOPLE, List.of("id"), List.of());
    assertEquals(CompressionType.GZIP, prepared.request().compression());
    assertEquals(';', prepared.request().input().fieldDelimiter());
    assertEquals(';', prepared.request().output().fieldDelimiter());
  }

  @Test
  void emptySchemaIsAConfigurationError() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> QueryRequestBuilder.build(options(), LOCATION, Schema.of(), List.of(), List.of()));
    assertEquals("Schema cannot be empty", e.getMessage());
    assertThrows(ConfigurationException.class,
        () -> QueryRequestBuilder.build(options(), LOCATION, null, List.of(), List.of()));
  }

  @Test
  void unknownColumnsFail() {
    assertThrows(UnknownColumnException.class,
        () -> QueryRequestBuilder.build(options(), LOCATION, PEOPLE, List.of("salary"), List.of()));
    assertThrows(UnknownColumnException.class,
        () -> QueryRequestBuilder.build(options(), LOCATION, PEOPLE, List.of("name"), List.of(gt("salary", 1))));
  }
}
