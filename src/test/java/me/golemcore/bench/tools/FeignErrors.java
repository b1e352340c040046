package me.golemcore.bench.tools;

import feign.FeignException;
import feign.Request;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

final class FeignErrors {

    private FeignErrors() {
    }

    static FeignException status(int status, String body) {
        Request request = Request.create(Request.HttpMethod.POST, "https://evidence.test/agent/web/search",
                Collections.emptyMap(), null, StandardCharsets.UTF_8, null);
        return FeignException.errorStatus("call", feign.Response.builder()
                .status(status)
                .reason("Error")
                .request(request)
                .headers(Collections.emptyMap())
                .body(body, StandardCharsets.UTF_8)
                .build());
    }
}
