package com.tripnav.service.tagger;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tripnav.model.TaggedEntity;
import com.tripnav.model.TaggedEntity.EntityCategory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Client for an external NER service that answers with spaCy-style labels:
 * POST {@code <baseUrl>/entities} with {@code {"text": ...}}, response
 * {@code {"entities": [{"text": ..., "label": ...}]}}.
 */
@Slf4j
public class RemoteEntityTagger implements EntityTagger {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final Gson gson = new Gson();
    private final String entitiesUrl;

    public RemoteEntityTagger(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.entitiesUrl = baseUrl.trim().replaceAll("/+$", "") + "/entities";
        log.info("Remote entity tagger configured at {}", entitiesUrl);
    }

    @Override
    public List<TaggedEntity> tag(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        JsonObject body = new JsonObject();
        body.addProperty("text", text);

        Request request = new Request.Builder()
                .url(entitiesUrl)
                .post(RequestBody.create(gson.toJson(body), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new EntityTaggingException("NER service error (" + response.code() + "): " + responseBody);
            }
            return parseEntities(responseBody);
        } catch (IOException e) {
            throw new EntityTaggingException("NER service unreachable: " + e.getMessage(), e);
        }
    }

    static List<TaggedEntity> parseEntities(String responseBody) {
        JsonObject data = JsonParser.parseString(responseBody).getAsJsonObject();
        List<TaggedEntity> entities = new ArrayList<>();
        if (!data.has("entities")) {
            return entities;
        }
        JsonArray array = data.getAsJsonArray("entities");
        for (JsonElement element : array) {
            JsonObject entity = element.getAsJsonObject();
            if (!entity.has("text") || !entity.has("label")) {
                continue;
            }
            entities.add(new TaggedEntity(
                    entity.get("text").getAsString(),
                    categoryFor(entity.get("label").getAsString())));
        }
        return entities;
    }

    static EntityCategory categoryFor(String label) {
        switch (label.toUpperCase(Locale.ROOT)) {
            case "GPE":
            case "LOC":
                return EntityCategory.PLACE_NAME;
            case "FAC":
            case "FACILITY":
                return EntityCategory.FACILITY;
            case "DATE":
            case "TIME":
                return EntityCategory.CALENDAR_TIME;
            default:
                return EntityCategory.OTHER;
        }
    }
}
