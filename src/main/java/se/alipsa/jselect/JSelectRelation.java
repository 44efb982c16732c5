package se.alipsa.jselect;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jselect.auth.Credentials;
import se.alipsa.jselect.auth.CredentialsChain;
import se.alipsa.jselect.client.SelectClient;
import se.alipsa.jselect.client.SelectClientFactory;
import se.alipsa.jselect.engine.ColumnNaming;
import se.alipsa.jselect.engine.DecodingRecordReader;
import se.alipsa.jselect.engine.FilterTranslator;
import se.alipsa.jselect.engine.FilteringRecordReader;
import se.alipsa.jselect.engine.PreparedQuery;
import se.alipsa.jselect.engine.ProjectingRecordReader;
import se.alipsa.jselect.engine.QueryRequestBuilder;
import se.alipsa.jselect.engine.RecordReader;
import se.alipsa.jselect.model.Predicate;
import se.alipsa.jselect.model.Schema;
import se.alipsa.jselect.request.ObjectLocation;

/**
 * A delimited text object queried through the remote select service, exposed
 * to a host engine as a relation supporting column pruning and predicate
 * pushdown.
 *
 * <p>
 * The relation holds no client. Each scan resolves credentials, opens its own
 * {@link SelectClient}, and releases it when the returned reader is closed, so
 * scans of different partitions can run concurrently.
 */
public final class JSelectRelation {

  private static final Logger log = LoggerFactory.getLogger(JSelectRelation.class);

  private final JSelectOptions options;
  private final ObjectLocation location;
  private final Schema schema;
  private final SelectClientFactory clientFactory;
  private final CredentialsChain credentials;

  /**
   * Create a relation.
   *
   * @param options
   *          validated options
   * @param location
   *          the queried object
   * @param schema
   *          the full schema of the object, must not be empty
   * @param clientFactory
   *          creates a client per scan
   * @param credentials
   *          where credentials come from
   * @throws ConfigurationException
   *           if the schema is missing or empty
   */
  public JSelectRelation(JSelectOptions options, ObjectLocation location, Schema schema,
      SelectClientFactory clientFactory, CredentialsChain credentials) {
    this.options = Objects.requireNonNull(options, "options");
    this.location = Objects.requireNonNull(location, "location");
    if (schema == null || schema.isEmpty()) {
      throw new ConfigurationException("Schema cannot be empty");
    }
    this.schema = schema;
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
  }

  /**
   * Create a relation for the object named by the {@code path} option, using
   * the default credentials chain.
   *
   * @param options
   *          validated options with a location
   * @param schema
   *          the full schema of the object
   * @param clientFactory
   *          creates a client per scan
   * @return the relation
   * @throws ConfigurationException
   *           if no location is configured or the schema is empty
   */
  public static JSelectRelation create(JSelectOptions options, Schema schema, SelectClientFactory clientFactory) {
    if (options.location() == null) {
      throw new ConfigurationException("Object location (path) missing from configuration");
    }
    return new JSelectRelation(options, options.location(), schema, clientFactory,
        CredentialsChain.defaultChain(options));
  }

  public Schema schema() {
    return schema;
  }

  public ObjectLocation location() {
    return location;
  }

  public JSelectOptions options() {
    return options;
  }

  /**
   * Predicates this relation leaves to the caller. Empty when local filtering
   * is enabled, since residual predicates are then applied to the scanned rows.
   *
   * @param predicates
   *          the predicates the caller wants applied
   * @return the predicates the caller must evaluate itself
   */
  public List<Predicate> unhandledFilters(List<Predicate> predicates) {
    if (options.localFilter()) {
      return List.of();
    }
    ColumnNaming naming = options.header() ? ColumnNaming.BY_NAME : ColumnNaming.BY_POSITION;
    return FilterTranslator.of(naming).split(schema, predicates).residual();
  }

  /**
   * Scan every column without filtering.
   *
   * @return a reader of rows in schema order
   * @throws IOException
   *           if the request cannot be sent
   */
  public RecordReader scan() throws IOException {
    return scan(List.of(), List.of());
  }

  /**
   * Scan the given columns without filtering.
   *
   * @param columns
   *          requested columns in output order
   * @return a reader of rows in {@code columns} order
   * @throws IOException
   *           if the request cannot be sent
   */
  public RecordReader scan(List<String> columns) throws IOException {
    return scan(columns, List.of());
  }

  /**
   * Scan the given columns, filtered by the conjunction of the predicates.
   *
   * @param columns
   *          requested columns in output order, empty for all
   * @param predicates
   *          filters; those the dialect cannot express are evaluated locally
   *          when {@code local_filter} is enabled and otherwise reported by
   *          {@link #unhandledFilters}
   * @return a reader of rows in {@code columns} order; closing it releases the
   *         stream and the client
   * @throws IOException
   *           if the client cannot be opened or the request fails
   */
  public RecordReader scan(List<String> columns, List<Predicate> predicates) throws IOException {
    PreparedQuery prepared = prepare(columns, predicates);
    Credentials creds = credentials.resolve();
    SelectClient client = clientFactory.open(options, creds);
    InputStream in;
    try {
      in = client.select(prepared.request());
    } catch (IOException | RuntimeException e) {
      closeAfterFailure(client, e);
      throw e;
    }
    log.debug("Scanning {} with {} predicate(s) evaluated locally", location,
        options.localFilter() ? prepared.residual().size() : 0);
    RecordReader reader = DecodingRecordReader.open(in, options.delimiter(), prepared.decodeSchema());
    if (options.localFilter()) {
      reader = FilteringRecordReader.wrap(reader, prepared.decodeSchema(), prepared.residual());
    }
    reader = ProjectingRecordReader.wrap(reader, prepared.decodeSchema(), prepared.schema());
    return new ScanRecordReader(reader, client);
  }

  /**
   * Build the request a scan would send, without sending it.
   *
   * @param columns
   *          requested columns in output order, empty for all
   * @param predicates
   *          filters
   * @return the prepared query
   */
  public PreparedQuery prepare(List<String> columns, List<Predicate> predicates) {
    return QueryRequestBuilder.build(options, location, schema, columns, predicates);
  }

  private static void closeAfterFailure(SelectClient client, Exception primary) {
    try {
      client.close();
    } catch (IOException e) {
      primary.addSuppressed(e);
    }
  }

  @Override
  public String toString() {
    return "JSelectRelation(" + location + ")";
  }
}
