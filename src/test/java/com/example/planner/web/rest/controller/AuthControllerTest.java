package com.example.planner.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.planner.web.rest.ApiConstants.Headers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("AuthController")
class AuthControllerTest {

  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.7");
  }

  @Nested
  @DisplayName("client address")
  class ClientAddress {

    @Test
    @DisplayName("uses the first forwarded hop")
    void firstForwardedHop() {
      // given
      request.addHeader(Headers.FORWARDED_FOR, " 203.0.113.9 , 10.0.0.1");

      // when
      String address = AuthController.clientAddress(request);

      // then
      assertThat(address).isEqualTo("203.0.113.9");
    }

    @Test
    @DisplayName("accepts an IPv6 hop")
    void ipv6Hop() {
      // given
      request.addHeader(Headers.FORWARDED_FOR, "2001:db8::8a2e:370:7334");

      // when
      String address = AuthController.clientAddress(request);

      // then
      assertThat(address).isEqualTo("2001:db8::8a2e:370:7334");
    }

    @Test
    @DisplayName("falls back to the peer address when the hop does not fit the address column")
    void overlongHop() {
      // given
      request.addHeader(Headers.FORWARDED_FOR, "1".repeat(46));

      // when
      String address = AuthController.clientAddress(request);

      // then
      assertThat(address).isEqualTo("10.0.0.7");
    }

    @Test
    @DisplayName("falls back to the peer address when the hop is not an address")
    void garbageHop() {
      // given
      request.addHeader(Headers.FORWARDED_FOR, "unknown, 10.0.0.1");

      // when
      String address = AuthController.clientAddress(request);

      // then
      assertThat(address).isEqualTo("10.0.0.7");
    }

    @Test
    @DisplayName("uses the peer address without a forwarded header")
    void noHeader() {
      // when
      String address = AuthController.clientAddress(request);

      // then
      assertThat(address).isEqualTo("10.0.0.7");
    }
  }
}
