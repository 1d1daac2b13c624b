package com.stargazer.tracker.crawl.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.stargazer.tracker.crawl.model.GitHubRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Translates a GraphQL search node into a {@link GitHubRepo}. API field names stop here.
 */
@Component
public class GitHubRepoMapper {
    private static final Logger log = LoggerFactory.getLogger(GitHubRepoMapper.class);

    public Optional<GitHubRepo> map(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject() || node.isEmpty()) {
            // non-repository hits come back as empty objects
            return Optional.empty();
        }
        String nodeId = text(node, "id");
        String nameWithOwner = text(node, "nameWithOwner");
        String name = text(node, "name");
        String ownerLogin = text(node.path("owner"), "login");
        if (nodeId == null || nameWithOwner == null || name == null || ownerLogin == null) {
            log.debug("Skipping malformed search node id={}", nodeId);
            return Optional.empty();
        }
        JsonNode language = node.path("primaryLanguage");
        return Optional.of(new GitHubRepo(
            nodeId,
            nameWithOwner,
            name,
            ownerLogin,
            text(node, "description"),
            language.isObject() ? text(language, "name") : null,
            node.path("isPrivate").asBoolean(false),
            Math.max(0, node.path("stargazerCount").asInt(0)),
            instant(node, "createdAt", nodeId),
            instant(node, "updatedAt", nodeId)
        ));
    }

    private String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private Instant instant(JsonNode node, String field, String nodeId) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable {}={} on node {}", field, value, nodeId);
            return null;
        }
    }
}
