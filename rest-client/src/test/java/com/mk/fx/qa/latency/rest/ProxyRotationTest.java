package com.mk.fx.qa.latency.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProxyRotationTest {

  private final ProxyRotation rotation =
      new ProxyRotation(
          "gw.{region}.proxy.example",
          9999,
          "customer-GH1-country-{country}",
          "secret",
          List.of("na", "eu", "as"),
          List.of("us", "de"));

  @Test
  void route_cyclesRegionsAndCountriesIndependently() {
    var first = rotation.route(0);
    var fourth = rotation.route(3);
    var fifth = rotation.route(4);

    assertThat(first.region()).isEqualTo("na");
    assertThat(first.country()).isEqualTo("us");
    assertThat(first.proxy().host()).isEqualTo("gw.na.proxy.example");
    assertThat(first.proxy().username()).isEqualTo("customer-GH1-country-us");
    assertThat(first.proxy().password()).isEqualTo("secret");
    assertThat(fourth.region()).isEqualTo("na");
    assertThat(fourth.country()).isEqualTo("de");
    assertThat(fifth.proxy().host()).isEqualTo("gw.eu.proxy.example");
  }

  @Test
  void route_withoutCountries_leavesHintEmpty() {
    var noCountries = new ProxyRotation("gw.{region}.proxy.example", 9999, "user-{country}", null, List.of("eu"), null);

    var route = noCountries.route(7);

    assertThat(route.country()).isNull();
    assertThat(route.proxy().username()).isEqualTo("user-");
    assertThat(route.proxy().hasCredentials()).isTrue();
  }

  @Test
  void invalidRotations_rejected() {
    assertThatThrownBy(() -> new ProxyRotation("gw.{region}.example", 9999, null, null, List.of(), null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("regions");
    assertThatThrownBy(() -> new ProxyRotation("gw.example", 0, null, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> rotation.route(-1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void authorization_isBasicOfUserAndPassword() {
    assertThat(new ProxySpec("p", 1, "user", "pw").authorization()).isEqualTo("Basic dXNlcjpwdw==");
    assertThat(new ProxySpec("p", 1, "user", null).authorization()).isEqualTo("Basic dXNlcjo=");
  }
}
