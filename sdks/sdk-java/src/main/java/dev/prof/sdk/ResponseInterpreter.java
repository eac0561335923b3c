package dev.prof.sdk;

import tools.jackson.core.JacksonException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ResponseInterpreter {
  private ResponseInterpreter() {}

  private static final String[] REQUIRED_PROFILE_FIELDS = {"uuid", "name", "email", "createdAt", "updatedAt"};

  enum Kind {
    ENVELOPE,
    ERROR_SHAPE,
    UNRECOGNIZED,
    UNPARSEABLE
  }

  static final class Parsed {
    final Kind kind;
    final Object tree;
    final Prof.ProfileResponse envelope;
    final String raw;
    final JacksonException failure;

    private Parsed(Kind kind, Object tree, Prof.ProfileResponse envelope, String raw, JacksonException failure) {
      this.kind = kind;
      this.tree = tree;
      this.envelope = envelope;
      this.raw = raw;
      this.failure = failure;
    }

    boolean hasEnvelope() {
      return envelope != null;
    }
  }

  static Parsed parse(String body) {
    Object tree;
    try {
      tree = Prof.MAPPER.readValue(body, Object.class);
    } catch (JacksonException e) {
      return new Parsed(Kind.UNPARSEABLE, null, null, body, e);
    }

    Prof.ProfileResponse envelope = asEnvelope(tree);
    if (envelope != null) {
      return new Parsed(Kind.ENVELOPE, tree, envelope, body, null);
    }
    envelope = asErrorShape(tree);
    if (envelope != null) {
      return new Parsed(Kind.ERROR_SHAPE, tree, envelope, body, null);
    }
    return new Parsed(Kind.UNRECOGNIZED, tree, null, body, null);
  }

  static Profile profile(Parsed parsed, int status, String notFoundDefault) {
    Prof.ProfileResponse envelope = requireEnvelope(parsed);
    if (!envelope.success) {
      throw failure(envelope, status, notFoundDefault);
    }
    if (envelope.profile == null) {
      throw new ProfException.ServiceException("No profile in response");
    }
    return envelope.profile;
  }

  static ProfException deleteFailure(Parsed parsed) {
    if (!parsed.hasEnvelope()) {
      return new ProfException.SerializationException("delete response is not an envelope: " + parsed.raw, parsed.failure);
    }
    return new ProfException.ServiceException(orDefault(parsed.envelope.error, "Delete failed"));
  }

  static Prof.MagicResponse spell(Parsed parsed) {
    if (parsed.tree instanceof Map && ((Map<?, ?>) parsed.tree).get("success") instanceof Boolean) {
      Prof.MagicResponse response;
      try {
        response = Prof.MAPPER.convertValue(parsed.tree, Prof.MagicResponse.class);
      } catch (JacksonException | IllegalArgumentException e) {
        throw new ProfException.SerializationException("spell response could not be decoded", e);
      }
      if (!response.success) {
        throw new ProfException.ServiceException(orDefault(response.error, "Spell execution failed"));
      }
      return response;
    }
    if (parsed.kind == Kind.ERROR_SHAPE) {
      throw new ProfException.ServiceException(parsed.envelope.error);
    }
    throw new ProfException.SerializationException("spell response is not valid: " + parsed.raw, parsed.failure);
  }

  static Prof.HealthResponse health(String body) {
    Prof.HealthResponse health;
    try {
      health = Prof.MAPPER.readValue(body, Prof.HealthResponse.class);
    } catch (JacksonException e) {
      throw new ProfException.SerializationException("health response could not be decoded", e);
    }
    if (health == null || health.status == null || health.service == null || health.version == null ||
        health.timestamp == null) {
      throw new ProfException.SerializationException("health response is missing fields: " + body, null);
    }
    return health;
  }

  private static Prof.ProfileResponse requireEnvelope(Parsed parsed) {
    switch (parsed.kind) {
      case ENVELOPE:
      case ERROR_SHAPE:
        return parsed.envelope;
      case UNRECOGNIZED:
        throw new ProfException.ServiceException("Invalid response format: " + parsed.raw);
      default:
        throw new ProfException.ServiceException("Could not parse response: " + parsed.raw);
    }
  }

  private static ProfException failure(Prof.ProfileResponse envelope, int status, String notFoundDefault) {
    if (status == 400) {
      if (envelope.details != null) {
        return new ProfException.ValidationException(envelope.details);
      }
      return new ProfException.ServiceException(orDefault(envelope.error, "Validation failed"));
    }
    if (status == 404) {
      return new ProfException.NotFoundException(orDefault(envelope.error, notFoundDefault));
    }
    return new ProfException.ServiceException(orDefault(envelope.error, "Unknown error"));
  }

  private static Prof.ProfileResponse asEnvelope(Object tree) {
    if (!(tree instanceof Map)) {
      return null;
    }
    Map<?, ?> object = (Map<?, ?>) tree;
    Object success = object.get("success");
    if (!(success instanceof Boolean)) {
      return null;
    }
    Object error = object.get("error");
    if (error != null && !(error instanceof String)) {
      return null;
    }

    List<String> details = null;
    Object rawDetails = object.get("details");
    if (rawDetails != null) {
      if (!(rawDetails instanceof List)) {
        return null;
      }
      details = new ArrayList<>();
      for (Object entry : (List<?>) rawDetails) {
        if (!(entry instanceof String)) {
          return null;
        }
        details.add((String) entry);
      }
    }

    Profile profile = null;
    Object rawProfile = object.get("profile");
    if (rawProfile != null) {
      if (!isProfileShape(rawProfile)) {
        return null;
      }
      try {
        profile = Prof.MAPPER.convertValue(rawProfile, Profile.class);
      } catch (JacksonException | IllegalArgumentException e) {
        throw new ProfException.SerializationException("profile could not be decoded", e);
      }
    }

    return new Prof.ProfileResponse((Boolean) success, profile, (String) error, details);
  }

  private static boolean isProfileShape(Object rawProfile) {
    if (!(rawProfile instanceof Map)) {
      return false;
    }
    Map<?, ?> fields = (Map<?, ?>) rawProfile;
    for (String field : REQUIRED_PROFILE_FIELDS) {
      if (!(fields.get(field) instanceof String)) {
        return false;
      }
    }
    Object imageFilename = fields.get("imageFilename");
    return imageFilename == null || imageFilename instanceof String;
  }

  private static Prof.ProfileResponse asErrorShape(Object tree) {
    if (!(tree instanceof Map)) {
      return null;
    }
    Map<?, ?> object = (Map<?, ?>) tree;
    Object error = object.get("error");
    if (!(error instanceof String)) {
      return null;
    }

    List<String> details = null;
    Object rawDetails = object.get("details");
    if (rawDetails instanceof List) {
      details = new ArrayList<>();
      for (Object entry : (List<?>) rawDetails) {
        if (entry instanceof String) {
          details.add((String) entry);
        }
      }
    }
    return new Prof.ProfileResponse(false, null, (String) error, details);
  }

  private static String orDefault(String value, String fallback) {
    return value != null ? value : fallback;
  }
}
