package dev.prof.sdk;

public interface ProfSigner {
  String publicKeyHex();

  byte[] sign(String message);
}
