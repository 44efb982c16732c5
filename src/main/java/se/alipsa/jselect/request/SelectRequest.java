package se.alipsa.jselect.request;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.jselect.ConfigurationException;

/**
 * Fully formed server side select request. Instances are immutable and can
 * only be obtained complete, through {@link Builder#build()}.
 */
public final class SelectRequest {

  /** The only expression type the remote service accepts. */
  public static final String EXPRESSION_TYPE = "SQL";

  private final ObjectLocation location;
  private final String expression;
  private final CsvInput input;
  private final CompressionType compression;
  private final CsvOutput output;

  private SelectRequest(Builder b) {
    this.location = b.location;
    this.expression = b.expression;
    this.input = b.input;
    this.compression = b.compression;
    this.output = b.output;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ObjectLocation location() {
    return location;
  }

  public String bucket() {
    return location.bucket();
  }

  public String key() {
    return location.key();
  }

  public String expression() {
    return expression;
  }

  public String expressionType() {
    return EXPRESSION_TYPE;
  }

  public CsvInput input() {
    return input;
  }

  public CompressionType compression() {
    return compression;
  }

  public CsvOutput output() {
    return output;
  }

  @Override
  public String toString() {
    return "SelectRequest{" + location + ", expression=" + expression + ", input=" + input + ", compression="
        + compression + ", output=" + output + "}";
  }

  /** Builder for {@link SelectRequest}. */
  public static final class Builder {
    private ObjectLocation location;
    private String expression;
    private CsvInput input;
    private CompressionType compression = CompressionType.NONE;
    private CsvOutput output;

    private Builder() {
    }

    public Builder location(ObjectLocation location) {
      this.location = location;
      return this;
    }

    public Builder expression(String expression) {
      this.expression = expression;
      return this;
    }

    public Builder input(CsvInput input) {
      this.input = input;
      return this;
    }

    public Builder compression(CompressionType compression) {
      this.compression = compression;
      return this;
    }

    public Builder output(CsvOutput output) {
      this.output = output;
      return this;
    }

    /**
     * Create the request.
     *
     * @return the immutable request
     * @throws ConfigurationException
     *           listing every missing part
     */
    public SelectRequest build() {
      List<String> missing = new ArrayList<>();
      if (location == null) {
        missing.add("location is missing");
      }
      if (expression == null || expression.isBlank()) {
        missing.add("expression is missing");
      }
      if (input == null) {
        missing.add("input serialization is missing");
      }
      if (compression == null) {
        missing.add("compression is missing");
      }
      if (output == null) {
        missing.add("output serialization is missing");
      }
      if (!missing.isEmpty()) {
        throw new ConfigurationException(missing);
      }
      return new SelectRequest(this);
    }
  }
}
