package com.example.JobCopilot.model;

import java.util.List;

public record PageResult<T>(List<T> items, int total) {

    public static <T> PageResult<T> of(List<T> items) {
        return new PageResult<>(items, items.size());
    }
}
