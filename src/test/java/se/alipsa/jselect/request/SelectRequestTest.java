package se.alipsa.jselect.request;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.jselect.ConfigurationException;

class SelectRequestTest {

  @Test
  void buildsCompleteRequest() {
    SelectRequest request = SelectRequest.builder()
        .location(ObjectLocation.parse("s3://b/k.csv.gz"))
        .expression("SELECT s.\"a\" FROM S3Object s")
        .input(CsvInput.of(HeaderInfo.USE, ','))
        .compression(CompressionType.GZIP)
        .output(CsvOutput.of(','))
        .build();
    assertEquals("b", request.bucket());
    assertEquals("k.csv.gz", request.key());
    assertEquals(SelectRequest.EXPRESSION_TYPE, request.expressionType());
    assertEquals(CompressionType.GZIP, request.compression());
    assertTrue(request.toString().contains("s3://b/k.csv.gz"));
  }

  @Test
  void compressionDefaultsToNone() {
    SelectRequest request = SelectRequest.builder()
        .location(new ObjectLocation("b", "k"))
        .expression("SELECT s.\"a\" FROM S3Object s")
        .input(CsvInput.of(HeaderInfo.NONE, ';'))
        .output(CsvOutput.of(';'))
        .build();
    assertEquals(CompressionType.NONE, request.compression());
  }

  @Test
  void listsEveryMissingPart() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> SelectRequest.builder().expression(" ").compression(null).build());
    assertEquals(List.of("location is missing", "expression is missing", "input serialization is missing",
        "compression is missing", "output serialization is missing"), e.problems());
  }

  @Test
  void delimitersMustDiffer() {
    assertThrows(IllegalArgumentException.class, () -> CsvInput.of(HeaderInfo.USE, '\n'));
    assertThrows(IllegalArgumentException.class, () -> CsvOutput.of('\n'));
  }

  @Test
  void parsesCompressionOption() {
    assertEquals(CompressionType.BZIP2, CompressionType.fromOption(" BZip2 "));
    assertEquals(CompressionType.NONE, CompressionType.fromOption("none"));
    assertNull(CompressionType.fromOption("zip"));
    assertNull(CompressionType.fromOption(null));
  }
}
