package com.example.incidentengine.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 envelope used on the event stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcMessage {

    @Builder.Default
    private String jsonrpc = "2.0";
    private String id;
    private String method;
    private Object params;
    private Object result;
    private JsonRpcError error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JsonRpcError {
        private int code;
        private String message;
    }

    public static JsonRpcMessage success(String id, Object result) {
        return JsonRpcMessage.builder()
                .id(id)
                .result(result)
                .build();
    }

    public static JsonRpcMessage error(String id, int code, String message) {
        return JsonRpcMessage.builder()
                .id(id)
                .error(JsonRpcError.builder().code(code).message(message).build())
                .build();
    }

    public static JsonRpcMessage notification(String method, Object params) {
        return JsonRpcMessage.builder()
                .method(method)
                .params(params)
                .build();
    }
}
