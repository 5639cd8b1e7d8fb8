package io.tm1client.rest.auth;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.tm1client.rest.errors.Tm1AuthException;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/// Exchanges an IBM Cloud API key for a bearer token at `{iam}/identity/token`.
///
/// The token is cached until one minute before the expiry the IAM service reports. Any
/// non-200 reply, or a reply without `access_token`, is a [Tm1AuthException]. A reply with
/// neither `expiration` nor `expires_in` is cached for [#FALLBACK_TTL].
public class IamTokenSource {
    private final static Logger logger = LogManager.getLogger(IamTokenSource.class);

    public static final String GRANT_TYPE = "urn:ibm:params:oauth:grant-type:apikey";

    /// Lifetime assumed for a token whose reply names no expiry.
    public static final Duration FALLBACK_TTL = Duration.ofMinutes(10);

    private final OkHttpClient httpClient;
    private final String tokenUrl;
    private final String apiKey;
    private final Clock clock;

    private String token;
    private Instant expiresAt = Instant.MIN;

    public IamTokenSource(OkHttpClient httpClient, String iamUrl, String apiKey) {
        this(httpClient, iamUrl, apiKey, Clock.systemUTC());
    }

    IamTokenSource(OkHttpClient httpClient, String iamUrl, String apiKey, Clock clock) {
        this.httpClient = httpClient;
        this.tokenUrl = stripTrailingSlash(iamUrl) + "/identity/token";
        this.apiKey = apiKey;
        this.clock = clock;
    }

    public synchronized String accessToken() {
        if (token != null && clock.instant().isBefore(expiresAt)) {
            return token;
        }
        Request request = new Request.Builder()
            .url(tokenUrl)
            .header("Accept", "application/json")
            .post(new FormBody.Builder()
                .add("grant_type", GRANT_TYPE)
                .add("apikey", apiKey)
                .build())
            .build();

        logger.debug("requesting IAM access token from {}", tokenUrl);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (response.code() != 200) {
                throw new Tm1AuthException("IAM token exchange failed with status " + response.code() + ": " + text);
            }
            JsonObject payload = JsonParser.parseString(text).getAsJsonObject();
            JsonElement accessToken = payload.get("access_token");
            if (accessToken == null || accessToken.isJsonNull() || accessToken.getAsString().isEmpty()) {
                throw new Tm1AuthException("IAM token exchange returned no access_token");
            }
            token = accessToken.getAsString();
            expiresAt = expiry(payload);
            return token;
        } catch (IOException e) {
            throw new Tm1AuthException("IAM token exchange failed: " + e.getMessage(), e);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            throw new Tm1AuthException("IAM token exchange returned malformed JSON", e);
        }
    }

    private Instant expiry(JsonObject payload) {
        Instant now = clock.instant();
        JsonElement expiration = payload.get("expiration");
        if (expiration != null && expiration.isJsonPrimitive()) {
            return Instant.ofEpochSecond(expiration.getAsLong()).minusSeconds(60);
        }
        JsonElement expiresIn = payload.get("expires_in");
        if (expiresIn != null && expiresIn.isJsonPrimitive()) {
            return now.plusSeconds(expiresIn.getAsLong()).minusSeconds(60);
        }
        logger.debug("IAM reply names no expiry, caching the token for {}", FALLBACK_TTL);
        return now.plus(FALLBACK_TTL);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
