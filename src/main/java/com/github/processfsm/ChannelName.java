package com.github.processfsm;

import java.util.Objects;

/**
 * An opaque channel identifier. Unforgeable names are minted by the name-creation construct and can
 * only be obtained by receiving them or by being in their scope; quoted names wrap a value
 * ({@code @"inbox"}); uri names address system channels ({@code `rho:io:stdout`}).
 */
public final class ChannelName {
  public enum Kind {
    UNFORGEABLE, QUOTED, URI;
  }

  private final Kind kind;
  private final String id;
  private final Value quoted;

  private ChannelName(final Kind kind, final String id, final Value quoted) {
    this.kind = kind;
    this.id = id;
    this.quoted = quoted;
  }

  static ChannelName unforgeable(final String id) {
    return new ChannelName(Kind.UNFORGEABLE, Objects.requireNonNull(id), null);
  }

  public static ChannelName quoted(final Value value) {
    return new ChannelName(Kind.QUOTED, null, Objects.requireNonNull(value));
  }

  /**
   * Shorthand for the public name {@code @"name"}.
   */
  public static ChannelName of(final String name) {
    return quoted(Value.ofString(name));
  }

  public static ChannelName uri(final String uri) {
    return new ChannelName(Kind.URI, Objects.requireNonNull(uri), null);
  }

  public Kind getKind() {
    return kind;
  }

  public String getId() {
    return id;
  }

  public Value getQuoted() {
    return quoted;
  }

  public Value toValue() {
    return Value.ofName(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, id, quoted);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ChannelName)) {
      return false;
    }
    final ChannelName other = (ChannelName) obj;
    return kind == other.kind && Objects.equals(id, other.id)
        && Objects.equals(quoted, other.quoted);
  }

  @Override
  public String toString() {
    switch (kind) {
      case UNFORGEABLE:
        return "Unf(" + id + ")";
      case URI:
        return "`" + id + "`";
      default:
        return "@" + quoted;
    }
  }
}
