package com.flamingo.ai.guidelines.service.ingestion;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import java.util.Locale;
import org.springframework.stereotype.Service;

/** Labels a chunk by lexical cues in its section path and opening text. */
@Service
public class ChunkClassifier {

  static final int INSPECTED_PREFIX_CHARS = 300;

  public ChunkType classify(String text, String sectionPath) {
    String body = text == null ? "" : text;
    String prefix = body.substring(0, Math.min(INSPECTED_PREFIX_CHARS, body.length()));
    String path = sectionPath == null ? "" : sectionPath;
    String source = (path + " " + prefix).toLowerCase(Locale.ROOT);
    for (ChunkType type : ChunkType.values()) {
      if (type.matches(source)) {
        return type;
      }
    }
    return ChunkType.OTHER;
  }
}
