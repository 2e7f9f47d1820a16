package io.agentcron.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListResponse<T>(List<T> list, long total, Integer offset, Integer size) {

    static <T> ListResponse<T> of(List<T> list, long total) {
        return new ListResponse<>(list, total, null, null);
    }
}
