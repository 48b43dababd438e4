package com.partnerbridge.bothub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Generic back-office reply: {@code {ok, result, description}}. */
public record BackOfficeResponse(boolean ok, JsonNode result, String description) {

  public static BackOfficeResponse failed(String description) {
    return new BackOfficeResponse(false, MissingNode.getInstance(), description);
  }

  /** The result as a list, whether the API returned an array or a single object. */
  public List<JsonNode> resultList() {
    List<JsonNode> out = new ArrayList<>();
    if (!ok || result == null || result.isMissingNode() || result.isNull()) {
      return out;
    }
    if (result.isArray()) {
      for (JsonNode n : result) {
        if (n != null && n.isObject()) out.add(n);
      }
    } else if (result.isObject()) {
      out.add(result);
    }
    return out;
  }

  public Optional<JsonNode> firstResult() {
    List<JsonNode> list = resultList();
    return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
  }
}
