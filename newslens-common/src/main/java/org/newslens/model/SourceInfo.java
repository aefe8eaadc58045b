package org.newslens.model;

/**
 * Citation attached to a generated answer.
 *
 * @param id   document identifier asserted by the model
 * @param name human-readable source name
 * @param url  link to the article, may be {@code null}
 */
public record SourceInfo(String id, String name, String url) {
}
