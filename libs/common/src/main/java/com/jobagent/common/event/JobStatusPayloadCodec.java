/*
 * Where: Common event payload definitions
 * What: Encodes and decodes JobStatusPayload as JSON
 * Why: The payload is embedded in a NOTIFY statement, so '/' is escaped on top of standard JSON
 * escaping
 */
package com.jobagent.common.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JobStatusPayloadCodec {

  private final ObjectMapper objectMapper;

  public JobStatusPayloadCodec(ObjectMapper objectMapper) {
    // copy() keeps the shared mapper untouched; the escapes only apply to this codec
    this.objectMapper = objectMapper.copy();
    this.objectMapper.getFactory().setCharacterEscapes(new SlashEscapes());
  }

  public String encode(JobStatusPayload payload) throws JsonProcessingException {
    return objectMapper.writeValueAsString(payload);
  }

  public JobStatusPayload decode(String json) throws JsonProcessingException {
    return objectMapper.readValue(json, JobStatusPayload.class);
  }

  private static final class SlashEscapes extends CharacterEscapes {

    private static final long serialVersionUID = 1L;
    private static final SerializedString ESCAPED_SLASH = new SerializedString("\\/");

    private final int[] asciiEscapes;

    private SlashEscapes() {
      asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
      asciiEscapes['/'] = CharacterEscapes.ESCAPE_CUSTOM;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
      return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
      return ch == '/' ? ESCAPED_SLASH : null;
    }
  }
}
