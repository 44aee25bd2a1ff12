package io.chunkmesh.identity;

public record IdentityCard(String node, String displayName, long revealedAtMs) {
}
