package dev.prof.sdk;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

final class MultipartForm {
  private final String boundary;
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  MultipartForm() {
    this("----prof-" + UUID.randomUUID().toString().replace("-", ""));
  }

  MultipartForm(String boundary) {
    this.boundary = boundary;
  }

  MultipartForm text(String name, String value) {
    write("--" + boundary + "\r\n");
    write("Content-Disposition: form-data; name=" + quote(name) + "\r\n\r\n");
    write(value);
    write("\r\n");
    return this;
  }

  MultipartForm file(String name, String filename, String contentType, byte[] content) {
    write("--" + boundary + "\r\n");
    write("Content-Disposition: form-data; name=" + quote(name) + "; filename=" + quote(filename) + "\r\n");
    write("Content-Type: " + contentType + "\r\n\r\n");
    body.writeBytes(content);
    write("\r\n");
    return this;
  }

  String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  HttpRequest.BodyPublisher publisher() {
    ByteArrayOutputStream closed = new ByteArrayOutputStream();
    closed.writeBytes(body.toByteArray());
    closed.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return HttpRequest.BodyPublishers.ofByteArray(closed.toByteArray());
  }

  // Quotes are percent-escaped the way browsers do; line breaks cannot appear in a part header.
  static String quote(String value) {
    if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
      throw new IllegalArgumentException("line break in form field name: " + value.trim());
    }
    return "\"" + value.replace("\"", "%22") + "\"";
  }

  private void write(String value) {
    body.writeBytes(value.getBytes(StandardCharsets.UTF_8));
  }
}
