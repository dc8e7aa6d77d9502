package com.codeheadsystems.oluso.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RedirectUriValidatorTest {

  private final RedirectUriValidator validator = new RedirectUriValidator();

  @Test
  void isValid_exactMatchOnly() {
    List<String> registered = List.of("https://app.example.com/callback");

    assertThat(validator.isValid("https://app.example.com/callback", registered)).isTrue();
    assertThat(validator.isValid("https://app.example.com/callback/", registered)).isFalse();
    assertThat(validator.isValid("https://app.example.com/callback?x=1", registered)).isFalse();
    assertThat(validator.isValid("https://APP.example.com/callback", registered)).isFalse();
    assertThat(validator.isValid(null, registered)).isFalse();
    assertThat(validator.isValid("", registered)).isFalse();
  }

  @Test
  void isValid_loopbackIgnoresPort() {
    List<String> registered = List.of("http://127.0.0.1/cb", "http://localhost:3000/cb");

    assertThat(validator.isValid("http://127.0.0.1:51234/cb", registered)).isTrue();
    assertThat(validator.isValid("http://localhost:8080/cb", registered)).isTrue();
    assertThat(validator.isValid("http://127.0.0.1:51234/other", registered)).isFalse();
    assertThat(validator.isValid("https://127.0.0.1:51234/cb", registered)).isFalse();
  }

  @Test
  void isValid_loopbackPortRuleDoesNotApplyToOtherHosts() {
    assertThat(validator.isValid("http://app.example.com:8080/cb", List.of("http://app.example.com/cb")))
        .isFalse();
  }

  @Test
  void isValid_customSchemeIsCaseInsensitive() {
    List<String> registered = List.of("com.example.app:/oauth2redirect");

    assertThat(validator.isValid("COM.EXAMPLE.APP:/oauth2redirect", registered)).isTrue();
    assertThat(validator.isValid("com.example.other:/oauth2redirect", registered)).isFalse();
  }
}
