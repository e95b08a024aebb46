package net.kili.client.graphql;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.ExecutionInput;
import graphql.GraphQLError;
import graphql.ParseAndValidate;
import graphql.ParseAndValidateResult;
import graphql.introspection.IntrospectionQuery;
import graphql.introspection.IntrospectionResultToSchema;
import graphql.language.AstPrinter;
import graphql.language.Document;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import graphql.schema.idl.errors.SchemaProblem;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.core.ObjectMapperFactory;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import net.kili.client.util.Stopwatch;

/** Fetches schemas by introspection, converts them to and from SDL, validates documents. */
public final class SchemaLoader {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(SchemaLoader.class);

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private SchemaLoader() {}

  /**
   * Runs the introspection query against the endpoint and prints the result as SDL.
   *
   * @param transport transport to the endpoint
   * @param headers extra headers of the call
   * @return schema document
   * @throws KiliException with {@link ErrorCode#SCHEMA_INTROSPECTION_FAILED}
   */
  public static String introspect(GraphQLTransport transport, Map<String, String> headers)
      throws KiliException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    GraphQLResponse response;
    try {
      response =
          transport.execute(
              new GraphQLRequest(
                  IntrospectionQuery.INTROSPECTION_QUERY,
                  Collections.emptyMap(),
                  "IntrospectionQuery",
                  headers));
    } catch (IOException ex) {
      throw new KiliException(
          ex, ErrorCode.SCHEMA_INTROSPECTION_FAILED, transport.getEndpoint(), ex.getMessage());
    }
    if (!response.isSuccess() || response.getData() == null) {
      String reason =
          response.hasErrors()
              ? response.getErrors().toString()
              : "HTTP " + response.getStatusCode();
      throw new KiliException(
          ErrorCode.SCHEMA_INTROSPECTION_FAILED, transport.getEndpoint(), reason);
    }

    Map<String, Object> introspectionResult =
        mapper.convertValue(response.getData(), new TypeReference<Map<String, Object>>() {});
    String sdl;
    try {
      Document document =
          new IntrospectionResultToSchema().createSchemaDefinition(introspectionResult);
      sdl = AstPrinter.printAst(document);
    } catch (RuntimeException ex) {
      throw new KiliException(
          ex, ErrorCode.SCHEMA_INTROSPECTION_FAILED, transport.getEndpoint(), ex.getMessage());
    }
    stopwatch.stop();
    logger.debug(
        "Introspected schema of {} in {} ms, {} characters",
        transport.getEndpoint(),
        stopwatch.elapsedMillis(),
        sdl.length());
    return sdl;
  }

  /**
   * Builds a schema usable for validation from its SDL. Scalars are given placeholder coercing.
   *
   * @param sdl schema document
   * @return parsed schema
   * @throws KiliException with {@link ErrorCode#SCHEMA_INVALID} if the document is not a valid
   *     schema
   */
  public static GraphQLSchema parseSchema(String sdl) throws KiliException {
    try {
      TypeDefinitionRegistry registry = new SchemaParser().parse(sdl);
      return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
    } catch (SchemaProblem ex) {
      throw new KiliException(ex, ErrorCode.SCHEMA_INVALID, ex.getMessage());
    }
  }

  /**
   * Parses and validates a document against a schema without executing it. Variable values are
   * not checked.
   *
   * @param schema schema to validate against
   * @param query GraphQL document
   * @param variables variable values
   * @return validation errors, empty when the document is valid
   */
  public static List<GraphQLError> validate(
      GraphQLSchema schema, String query, Map<String, Object> variables) {
    ExecutionInput input =
        ExecutionInput.newExecutionInput()
            .query(query)
            .variables(variables == null ? Collections.emptyMap() : variables)
            .build();
    ParseAndValidateResult result = ParseAndValidate.parseAndValidate(schema, input);
    return result.getErrors();
  }
}
