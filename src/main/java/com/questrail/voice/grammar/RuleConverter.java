package com.questrail.voice.grammar;

import java.util.List;

/**
 * Builds a typed value from the values collected while matching a rule.
 *
 * <p>Converters run on task threads, may be invoked for partial matches that
 * are later abandoned, and must therefore be stateless. They must not return
 * {@code null}.</p>
 */
@FunctionalInterface
public interface RuleConverter
{
    Object convert(List<Object> values);
}
