package io.intellixity.strata.query;

import java.util.Objects;

public record OrderSpec(String member, Direction direction) {
  public OrderSpec {
    Objects.requireNonNull(member, "member");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static OrderSpec asc(String member) { return new OrderSpec(member, Direction.ASC); }
  public static OrderSpec desc(String member) { return new OrderSpec(member, Direction.DESC); }

  public enum Direction { ASC, DESC }
}
