package com.partnerbridge.bothub.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public record InlineKeyboard(List<List<Button>> rows) implements ReplyMarkup {

  public record Button(String text, String callbackData) {}

  public static InlineKeyboard singleRow(Button... buttons) {
    return new InlineKeyboard(List.of(List.of(buttons)));
  }

  @Override
  public Map<String, Object> toTelegram() {
    var out = new ArrayList<List<Map<String, Object>>>();
    for (var row : rows) {
      var outRow = new ArrayList<Map<String, Object>>();
      if (row != null) {
        for (var btn : row) {
          if (btn == null) continue;
          var b = new HashMap<String, Object>();
          b.put("text", btn.text());
          b.put("callback_data", btn.callbackData());
          outRow.add(b);
        }
      }
      out.add(outRow);
    }
    return Map.of("inline_keyboard", out);
  }
}
