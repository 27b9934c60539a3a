package com.gentoro.nuggets;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nuggets.exception.ValidationException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNameValuePairsAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--input", "page.txt", "--types", "tool,media", "--verbose"});
    assertEquals("page.txt", params.getParameter("input"));
    assertEquals("tool,media", params.getParameter("types"));
    assertEquals("true", params.getParameter("verbose"));
    assertTrue(params.getOptionalParameter("prompt").isEmpty());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
  }

  @Test
  void configFileCanBeOverridden() {
    StartupParameters params =
        new StartupParameters(new String[] {"--config-file", "conf/local.yaml", "--input", "x"});
    assertEquals("conf/local.yaml", params.configFile());
  }

  @Test
  void inputIsRequiredUnlessHelp() {
    assertThrows(ValidationException.class, () -> new StartupParameters(new String[] {}));
    assertTrue(new StartupParameters(new String[] {"--help"}).isParameterPresent("help"));
  }

  @Test
  void blankConfigFileIsRejected() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--config-file", " ", "--input", "x"}));
  }
}
