package com.poc.svc.ingestion.config;

import com.poc.svc.ingestion.util.TraceContext;
import io.swagger.v3.oas.models.Operation;
import org.junit.jupiter.api.Test;
import org.springdoc.core.models.GroupedOpenApi;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenApiConfigTest {

    private final OpenApiConfig config = new OpenApiConfig(new IngestionProperties());

    @Test
    void description_listsConfiguredQueuesAndDeadLetterSuffix() {
        assertThat(config.ingestionOpenAPI().getInfo().getDescription())
                .contains("products", "stocks", "prices")
                .contains(".dlq");
    }

    @Test
    void groups_splitDocumentsFromConsumerStatus() {
        GroupedOpenApi documents = config.documentsApi();
        GroupedOpenApi consumers = config.consumersApi();

        assertThat(documents.getGroup()).isEqualTo(OpenApiConfig.DOCUMENTS_GROUP);
        assertThat(documents.getPathsToMatch()).containsExactly("/api/v1/**");
        assertThat(consumers.getGroup()).isEqualTo(OpenApiConfig.CONSUMERS_GROUP);
        assertThat(consumers.getPathsToMatch()).containsExactly("/ingestion/**");
    }

    @Test
    void operations_declareOptionalTraceIdHeader() {
        Operation operation = OpenApiConfig.traceIdHeader().customize(new Operation(), null);

        assertThat(operation.getParameters()).singleElement().satisfies(parameter -> {
            assertThat(parameter.getIn()).isEqualTo("header");
            assertThat(parameter.getName()).isEqualTo(TraceContext.TRACE_ID_HEADER);
            assertThat(parameter.getRequired()).isFalse();
        });
        assertThat(List.of(config.documentsApi(), config.consumersApi()))
                .allSatisfy(group -> assertThat(group.getOperationCustomizers()).hasSize(1));
    }
}
