package com.example.schedulerservice.auth;

import org.junit.Test;

import java.net.URI;
import java.net.http.HttpRequest;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ApiKeysTest {

    @Test
    public void unconfigured_key_lets_everything_through() {
        assertThat(ApiKeys.matches("", null), is(true));
        assertThat(ApiKeys.matches(null, "anything"), is(true));
    }

    @Test
    public void configured_key_must_match_exactly() {
        assertThat(ApiKeys.matches("k", "k"), is(true));
        assertThat(ApiKeys.matches("k", null), is(false));
        assertThat(ApiKeys.matches("k", "K"), is(false));
        assertThat(ApiKeys.matches("k", "k "), is(false));
    }

    @Test
    public void header_is_attached_only_when_configured() {
        HttpRequest with = ApiKeys.attach(HttpRequest.newBuilder(URI.create("http://x/")), "k").build();
        HttpRequest without = ApiKeys.attach(HttpRequest.newBuilder(URI.create("http://x/")), "").build();

        assertThat(with.headers().firstValue(ApiKeys.HEADER).get(), is("k"));
        assertThat(without.headers().firstValue(ApiKeys.HEADER).isPresent(), is(false));
    }
}
