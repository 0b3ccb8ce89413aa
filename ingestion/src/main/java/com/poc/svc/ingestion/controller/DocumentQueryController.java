package com.poc.svc.ingestion.controller;

import com.poc.svc.ingestion.dto.ErrorResponse;
import com.poc.svc.ingestion.service.DocumentQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/{collection}")
public class DocumentQueryController {

    private static final String LIMIT_PARAM = "limit";

    private final DocumentQueryService documentQueryService;

    public DocumentQueryController(DocumentQueryService documentQueryService) {
        this.documentQueryService = documentQueryService;
    }

    @GetMapping("/{productCode}")
    @Operation(
            operationId = "getDocument",
            summary = "Get the stored document for a product code",
            description = "依 collection 與 product_code 讀取最新寫入的文件。",
            parameters = {
                    @Parameter(name = "collection", in = ParameterIn.PATH, required = true,
                            description = "products、stocks 或 prices"),
                    @Parameter(name = "productCode", in = ParameterIn.PATH, required = true,
                            description = "產品代碼，即文件 _id")
            },
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Stored document",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    examples = @ExampleObject(
                                            name = "productExample",
                                            value = """
                                                    {
                                                      "collection": "products",
                                                      "product_code": "P-1",
                                                      "name": "Widget",
                                                      "currency": "USD",
                                                      "received_at": "2025-11-14T01:13:00.971Z"
                                                    }
                                                    """))),
                    @ApiResponse(
                            responseCode = "400",
                            description = "未知的 collection",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(
                            responseCode = "404",
                            description = "查無文件",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    public ResponseEntity<Map<String, Object>> getDocument(@PathVariable String collection,
                                                           @PathVariable String productCode) {
        return ResponseEntity.ok(documentQueryService.findByProductCode(collection, productCode));
    }

    @GetMapping
    @Operation(
            operationId = "listDocuments",
            summary = "List stored documents with equality filters",
            description = "除 limit 以外的 query parameter 皆視為等值篩選，欄位必須是該 collection schema 宣告的欄位。",
            parameters = {
                    @Parameter(name = "collection", in = ParameterIn.PATH, required = true,
                            description = "products、stocks 或 prices"),
                    @Parameter(name = LIMIT_PARAM, in = ParameterIn.QUERY, required = false,
                            description = "回傳筆數上限，1 到 100，預設 10")
            },
            responses = {
                    @ApiResponse(responseCode = "200", description = "Matching documents"),
                    @ApiResponse(
                            responseCode = "400",
                            description = "未知的 collection、limit 超出範圍或篩選欄位未宣告",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON_VALUE,
                                    schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    public ResponseEntity<List<Map<String, Object>>> listDocuments(
            @PathVariable String collection,
            @RequestParam(name = LIMIT_PARAM, defaultValue = "" + DocumentQueryService.DEFAULT_LIMIT) int limit,
            @Parameter(hidden = true) @RequestParam Map<String, String> queryParameters
    ) {
        Map<String, String> filters = new LinkedHashMap<>(queryParameters);
        filters.remove(LIMIT_PARAM);
        return ResponseEntity.ok(documentQueryService.find(collection, filters, limit));
    }
}
