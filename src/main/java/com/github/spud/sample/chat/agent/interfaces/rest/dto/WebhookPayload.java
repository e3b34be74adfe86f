package com.github.spud.sample.chat.agent.interfaces.rest.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.util.StringUtils;

/**
 * The parts of a WhatsApp Cloud API webhook notification this service reads
 * <pre>
 * {"entry": [{"changes": [{"value": {"messages": [{"from": "+1555...", "text": {"body": "Hi"}}]}}]}]}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookPayload {

  private List<Entry> entry = new ArrayList<>();

  /**
   * Text messages with both a sender and a body, in payload order
   */
  @JsonIgnore
  public List<InboundMessage> textMessages() {
    List<InboundMessage> messages = new ArrayList<>();
    for (Entry e : orEmpty(entry)) {
      for (Change change : orEmpty(e.getChanges())) {
        if (change.getValue() == null) {
          continue;
        }
        for (Message message : orEmpty(change.getValue().getMessages())) {
          String body = message.getText() != null ? message.getText().getBody() : null;
          if (StringUtils.hasText(message.getFrom()) && StringUtils.hasText(body)) {
            messages.add(new InboundMessage(message.getFrom(), body));
          }
        }
      }
    }
    return messages;
  }

  private static <T> List<T> orEmpty(List<T> list) {
    return list != null ? list : List.of();
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Entry {

    private String id;
    private List<Change> changes = new ArrayList<>();
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Change {

    private String field;
    private Value value;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Value {

    private List<Message> messages = new ArrayList<>();
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Message {

    private String from;
    private String id;
    private String type;
    private Text text;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Text {

    private String body;
  }

  public record InboundMessage(String from, String text) {
  }
}
