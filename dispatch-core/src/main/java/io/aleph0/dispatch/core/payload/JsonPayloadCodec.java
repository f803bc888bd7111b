/*-
 * =================================LICENSE_START==================================
 * dispatch-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.dispatch.core.payload;

import static java.util.Objects.requireNonNull;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aleph0.dispatch.core.MalformedPayloadException;
import io.aleph0.dispatch.core.Payload;

/**
 * Reads and writes payloads as JSON objects of the following form:
 *
 * <pre>
 * {
 *   "owner": "u1",
 *   "correlation_id": "12345",
 *   "body": "hello",
 *   "timestamp": "2025-01-01T12:00:00Z",
 *   "attachments": [ { "file_id": "..." } ],
 *   "context": { "name": "..." }
 * }
 * </pre>
 *
 * <p>
 * Only {@code owner}, {@code correlation_id}, and {@code body} are required. The correlation id may
 * be a string or an integer. For compatibility with older producers, {@code user_id},
 * {@code chat_id}, {@code message}, and {@code onboarding} are accepted in place of {@code owner},
 * {@code correlation_id}, {@code body}, and {@code context}, respectively.
 *
 * <p>
 * Attachments that are not JSON objects are dropped with a warning rather than failing the whole
 * message.
 */
public class JsonPayloadCodec implements PayloadCodec {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonPayloadCodec.class);

  public static final String OWNER = "owner";
  public static final String CORRELATION_ID = "correlation_id";
  public static final String BODY = "body";
  public static final String TIMESTAMP = "timestamp";
  public static final String ATTACHMENTS = "attachments";
  public static final String CONTEXT = "context";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JsonPayloadCodec() {
    this(new ObjectMapper());
  }

  public JsonPayloadCodec(ObjectMapper mapper) {
    this.mapper = requireNonNull(mapper, "mapper");
  }

  @Override
  public Payload decode(String body) throws MalformedPayloadException {
    if (body == null || body.isBlank())
      throw new MalformedPayloadException("empty payload");

    final JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException("invalid JSON", e);
    }
    if (root == null || !root.isObject())
      throw new MalformedPayloadException("payload is not a JSON object");

    final String owner = requiredText(root, OWNER, "user_id");
    if (owner.isBlank())
      throw new MalformedPayloadException("blank " + OWNER);

    final String correlationId = correlationId(field(root, CORRELATION_ID, "chat_id"));
    final String text = requiredText(root, BODY, "message");
    final Instant timestamp = timestamp(root.get(TIMESTAMP));
    final List<Map<String, Object>> attachments = attachments(root.get(ATTACHMENTS));
    final Map<String, Object> context = context(field(root, CONTEXT, "onboarding"));

    return new Payload(owner, correlationId, text, timestamp, attachments, context);
  }

  @Override
  public String encode(Payload payload) {
    requireNonNull(payload, "payload");
    final ObjectNode root = mapper.createObjectNode();
    root.put(OWNER, payload.owner());
    root.put(CORRELATION_ID, payload.correlationId());
    root.put(BODY, payload.body());
    if (payload.timestamp() != null)
      root.put(TIMESTAMP, payload.timestamp().toString());
    if (payload.hasAttachments()) {
      final ArrayNode attachments = root.putArray(ATTACHMENTS);
      for (Map<String, Object> attachment : payload.attachments())
        attachments.add(mapper.valueToTree(attachment));
    }
    if (!payload.context().isEmpty())
      root.set(CONTEXT, mapper.valueToTree(payload.context()));
    try {
      return mapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      // A tree of plain values always serializes
      throw new UncheckedIOException(e);
    }
  }

  private static JsonNode field(JsonNode root, String name, String alias) {
    final JsonNode result = root.get(name);
    if (result != null && !result.isNull())
      return result;
    return root.get(alias);
  }

  private static String requiredText(JsonNode root, String name, String alias)
      throws MalformedPayloadException {
    final JsonNode node = field(root, name, alias);
    if (node == null || node.isNull())
      throw new MalformedPayloadException("missing required field " + name);
    if (!node.isTextual())
      throw new MalformedPayloadException("field " + name + " must be a string");
    return node.textValue();
  }

  private static String correlationId(JsonNode node) throws MalformedPayloadException {
    if (node == null || node.isNull())
      throw new MalformedPayloadException("missing required field " + CORRELATION_ID);
    if (node.isTextual())
      return node.textValue();
    if (node.isIntegralNumber())
      return node.bigIntegerValue().toString();
    throw new MalformedPayloadException(
        "field " + CORRELATION_ID + " must be a string or an integer");
  }

  private static Instant timestamp(JsonNode node) throws MalformedPayloadException {
    if (node == null || node.isNull())
      return null;
    if (!node.isTextual())
      throw new MalformedPayloadException("field " + TIMESTAMP + " must be a string");
    final String text = node.textValue();
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      // Timestamps without an offset are taken to be UTC
      try {
        return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException x) {
        throw new MalformedPayloadException("invalid " + TIMESTAMP + " " + text, x);
      }
    }
  }

  private List<Map<String, Object>> attachments(JsonNode node) {
    if (node == null || node.isNull())
      return List.of();
    if (!node.isArray()) {
      LOGGER.atWarn().addKeyValue("type", node.getNodeType())
          .log("Ignoring attachments that are not an array");
      return List.of();
    }
    final List<Map<String, Object>> result = new ArrayList<>(node.size());
    for (JsonNode item : node) {
      if (item.isObject()) {
        result.add(mapper.convertValue(item, MAP_TYPE));
      } else {
        LOGGER.atWarn().addKeyValue("type", item.getNodeType())
            .log("Ignoring attachment that is not an object");
      }
    }
    return result;
  }

  private Map<String, Object> context(JsonNode node) {
    if (node == null || node.isNull())
      return Map.of();
    if (!node.isObject()) {
      LOGGER.atWarn().addKeyValue("type", node.getNodeType())
          .log("Ignoring context that is not an object");
      return Map.of();
    }
    return mapper.convertValue(node, MAP_TYPE);
  }
}
