package com.poc.svc.ingestion.config;

import com.poc.svc.ingestion.util.TraceContext;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 文件查詢與 consumer 狀態分成兩個 API group，每個 operation 都標示可選的 X-Trace-Id header。
 */
@Configuration
public class OpenApiConfig {

    static final String DOCUMENTS_GROUP = "documents";
    static final String CONSUMERS_GROUP = "consumers";

    private final IngestionProperties properties;

    public OpenApiConfig(IngestionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public OpenAPI ingestionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Product Data Ingestion API")
                        .version("v1")
                        .description("查詢由 queue %s 寫入 MongoDB 的文件；無法處理的訊息轉送至 <queue>%s"
                                .formatted(properties.getQueues(), properties.getDeadLetterSuffix())));
    }

    @Bean
    public GroupedOpenApi documentsApi() {
        return GroupedOpenApi.builder()
                .group(DOCUMENTS_GROUP)
                .displayName("Stored documents")
                .pathsToMatch("/api/v1/**")
                .addOperationCustomizer(traceIdHeader())
                .build();
    }

    @Bean
    public GroupedOpenApi consumersApi() {
        return GroupedOpenApi.builder()
                .group(CONSUMERS_GROUP)
                .displayName("Queue consumers")
                .pathsToMatch("/ingestion/**")
                .addOperationCustomizer(traceIdHeader())
                .build();
    }

    static OperationCustomizer traceIdHeader() {
        return (operation, handlerMethod) -> operation.addParametersItem(new HeaderParameter()
                .name(TraceContext.TRACE_ID_HEADER)
                .required(false)
                .description("沿用於 log 與回應 header 的 traceId，未帶或格式不符時由服務產生")
                .schema(new StringSchema().pattern(TraceIdFilter.ACCEPTED_TRACE_ID.pattern())));
    }
}
