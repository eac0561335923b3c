package dev.prof.sdk;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseInterpreterTest {
  private static final String PROFILE =
      "{\"uuid\":\"u1\",\"name\":\"A\",\"email\":\"a@x.com\",\"createdAt\":\"t1\",\"updatedAt\":\"t1\"";

  @Test
  void fullEnvelopeKeepsExtraProfileFields() {
    ResponseInterpreter.Parsed parsed = ResponseInterpreter.parse(
        "{\"success\":true,\"profile\":" + PROFILE + ",\"bio\":\"hi\",\"links\":[\"a\",\"b\"]}}");

    assertEquals(ResponseInterpreter.Kind.ENVELOPE, parsed.kind);
    Profile profile = ResponseInterpreter.profile(parsed, 200, "Not found");
    assertEquals("A", profile.getName());
    assertEquals("a@x.com", profile.getEmail());
    assertEquals("t1", profile.getCreatedAt());
    assertEquals("hi", profile.additionalFields().get("bio"));
    assertEquals(List.of("a", "b"), profile.additionalFields().get("links"));
    assertFalse(profile.additionalFields().containsKey("name"));
  }

  @Test
  void bareErrorObjectDropsNonStringDetails() {
    ResponseInterpreter.Parsed parsed =
        ResponseInterpreter.parse("{\"error\":\"Invalid\",\"details\":[\"a\",1,{\"x\":2},\"b\"]}");

    assertEquals(ResponseInterpreter.Kind.ERROR_SHAPE, parsed.kind);
    assertFalse(parsed.envelope.success);
    assertEquals("Invalid", parsed.envelope.error);
    assertEquals(List.of("a", "b"), parsed.envelope.details);
  }

  @Test
  void envelopeWithMalformedFieldsFallsBackToErrorShape() {
    ResponseInterpreter.Parsed parsed =
        ResponseInterpreter.parse("{\"success\":false,\"error\":\"Invalid\",\"details\":[\"a\",2]}");
    assertEquals(ResponseInterpreter.Kind.ERROR_SHAPE, parsed.kind);
    assertEquals(List.of("a"), parsed.envelope.details);

    parsed = ResponseInterpreter.parse("{\"success\":true,\"profile\":{\"uuid\":\"u1\",\"name\":\"A\"}}");
    assertEquals(ResponseInterpreter.Kind.UNRECOGNIZED, parsed.kind);
  }

  @Test
  void distinguishesUnrecognizedFromUnparseable() {
    assertEquals(ResponseInterpreter.Kind.UNRECOGNIZED, ResponseInterpreter.parse("[1,2]").kind);
    assertEquals(ResponseInterpreter.Kind.UNRECOGNIZED, ResponseInterpreter.parse("{\"error\":42}").kind);
    assertEquals(ResponseInterpreter.Kind.UNPARSEABLE, ResponseInterpreter.parse("not json at all").kind);

    ProfException.ServiceException unrecognized = assertThrows(ProfException.ServiceException.class,
        () -> ResponseInterpreter.profile(ResponseInterpreter.parse("[1,2]"), 200, "Not found"));
    assertTrue(unrecognized.getReason().startsWith("Invalid response format: "));

    ProfException.ServiceException unparseable = assertThrows(ProfException.ServiceException.class,
        () -> ResponseInterpreter.profile(ResponseInterpreter.parse("not json at all"), 500, "Not found"));
    assertTrue(unparseable.getReason().startsWith("Could not parse response: "));
  }

  @Test
  void statusDrivesFailureType() {
    ResponseInterpreter.Parsed notFound = ResponseInterpreter.parse("{\"success\":false,\"error\":\"Profile not found\"}");
    ProfException.NotFoundException missing = assertThrows(ProfException.NotFoundException.class,
        () -> ResponseInterpreter.profile(notFound, 404, "Not found"));
    assertEquals("Profile not found", missing.getReason());

    ResponseInterpreter.Parsed invalid = ResponseInterpreter.parse(
        "{\"success\":false,\"error\":\"Invalid\",\"details\":[\"name required\",\"email invalid\"]}");
    ProfException.ValidationException validation = assertThrows(ProfException.ValidationException.class,
        () -> ResponseInterpreter.profile(invalid, 400, "Not found"));
    assertEquals(List.of("name required", "email invalid"), validation.getErrors());

    ProfException.ServiceException other = assertThrows(ProfException.ServiceException.class,
        () -> ResponseInterpreter.profile(invalid, 409, "Not found"));
    assertEquals("Invalid", other.getReason());
  }

  @Test
  void spellKeepsUnknownFields() {
    Prof.MagicResponse response = ResponseInterpreter.spell(
        ResponseInterpreter.parse("{\"success\":true,\"result\":{\"ok\":true}}"));

    assertTrue(response.success);
    assertEquals(Map.of("ok", true), response.data().get("result"));
    assertFalse(response.data().containsKey("success"));
  }
}
