package banstore.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void validTableNameReturnsName() {
    assertEquals("ip_addresses", TableNames.validate("ip_addresses"));
    assertEquals("Bans2", TableNames.validate("Bans2"));
    assertEquals("_x", TableNames.validate("_x"));
  }

  @Test
  void defaultTableConstant() {
    assertEquals("ip_addresses", TableNames.DEFAULT_TABLE);
  }

  @Test
  void nullTableNameThrows() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void injectionAttemptsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("bans; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("schema.bans"));
  }
}
