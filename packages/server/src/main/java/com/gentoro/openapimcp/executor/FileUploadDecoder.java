package com.gentoro.openapimcp.executor;

import com.gentoro.openapimcp.exception.IoException;
import com.gentoro.openapimcp.exception.ValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Turns the {@code _file_upload} argument into raw bytes. Accepted forms, tried in order:
 *
 * <ol>
 *   <li>a {@code data:} URL, {@code data:<mime>;base64,<payload>} or {@code data:<mime>,<text>}
 *   <li>the path of an existing regular file
 *   <li>a bare base64 string
 * </ol>
 */
public final class FileUploadDecoder {
  private static final org.slf4j.Logger log =
      com.gentoro.openapimcp.logging.LoggingService.getLogger(FileUploadDecoder.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private FileUploadDecoder() {}

  public static byte[] decode(String value) {
    if (value == null) {
      throw new ValidationException("File upload value is missing");
    }
    if (value.startsWith("data:")) {
      return decodeDataUrl(value);
    }
    Path file = asExistingFile(value);
    if (file != null) {
      log.debug("Reading upload from local file {}", file);
      try {
        return Files.readAllBytes(file);
      } catch (IOException e) {
        throw new IoException("Failed to read file " + value + ": " + e.getMessage(), e);
      }
    }
    try {
      return base64(value);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Failed to decode base64 file upload: " + e.getMessage(), e);
    }
  }

  private static byte[] decodeDataUrl(String value) {
    int comma = value.indexOf(',');
    if (comma < 0) {
      throw new ValidationException("Invalid data URL format");
    }
    String header = value.substring("data:".length(), comma);
    String payload = value.substring(comma + 1);
    if (header.endsWith(";base64")) {
      try {
        return base64(payload);
      } catch (IllegalArgumentException e) {
        throw new ValidationException("Failed to decode base64 data URL: " + e.getMessage(), e);
      }
    }
    return payload.getBytes(StandardCharsets.UTF_8);
  }

  // Line breaks are tolerated, any other non-alphabet character is an error.
  private static byte[] base64(String encoded) {
    return Base64.getDecoder().decode(WHITESPACE.matcher(encoded).replaceAll(""));
  }

  private static Path asExistingFile(String value) {
    if (value.isBlank() || value.length() > 4096) return null;
    try {
      Path path = Path.of(value);
      return Files.isRegularFile(path) ? path : null;
    } catch (InvalidPathException e) {
      return null;
    }
  }
}
