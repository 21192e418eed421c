package com.ripple.resilience.model;

import java.util.Map;

@FunctionalInterface
public interface FallbackAction {
    Object execute(Map<String, Object> context) throws Exception;
}
