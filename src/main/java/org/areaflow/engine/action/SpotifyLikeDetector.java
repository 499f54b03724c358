package org.areaflow.engine.action;

import com.fasterxml.jackson.databind.JsonNode;
import org.areaflow.engine.catalog.ActionDefinition;
import org.areaflow.engine.catalog.Placeholder;
import org.areaflow.engine.client.SpotifyApiClient;
import org.areaflow.engine.credential.CredentialResolver;
import org.areaflow.engine.detection.DetectionCache;
import org.areaflow.engine.provider.SpotifyProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.StreamSupport;
import java.util.stream.Collectors;

/**
 * Fires when the user saves a new track to their Spotify library.
 */
@Component
public class SpotifyLikeDetector extends LatestItemDetector<JsonNode> {

    public static final String NAME = "spotify_has_likes";

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            NAME,
            SpotifyProvider.KEY,
            "Triggers when you like a new song on Spotify",
            List.of(),
            List.of(
                    new Placeholder("SPOTIFY_LIKED_SONG_NAME", "Title of the liked song", "Bohemian Rhapsody"),
                    new Placeholder("SPOTIFY_LIKED_SONG_ARTIST", "Artist(s) of the liked song", "Queen"),
                    new Placeholder("SPOTIFY_LIKED_SONG_ALBUM", "Album of the liked song", "A Night at the Opera"),
                    new Placeholder("SPOTIFY_LIKED_SONG_ALBUM_RELEASE_DATE", "Album release date", "1975-11-21"),
                    new Placeholder("SPOTIFY_LIKED_SONG_DURATION_MS", "Duration in milliseconds", "354320"),
                    new Placeholder("SPOTIFY_LIKED_SONG_URL", "Spotify link to the song", "https://open.spotify.com/track/abc"),
                    new Placeholder("SPOTIFY_LIKED_SONG_ID", "Spotify track id", "4u7EnebtmKWzUH433cf5Qv"),
                    new Placeholder("SPOTIFY_LIKED_SONG_ADDED_AT", "When the song was liked", "2024-05-01T10:15:30Z")));

    private final CredentialResolver credentialResolver;
    private final SpotifyApiClient spotifyApiClient;

    public SpotifyLikeDetector(DetectionCache detectionCache, CredentialResolver credentialResolver,
                               SpotifyApiClient spotifyApiClient) {
        super(detectionCache);
        this.credentialResolver = credentialResolver;
        this.spotifyApiClient = spotifyApiClient;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionDefinition definition() {
        return DEFINITION;
    }

    @Override
    protected Optional<LatestItem<JsonNode>> fetchLatest(String userId, Map<String, Object> actionConfig) {
        JsonNode page = credentialResolver.withAccessToken(userId, SpotifyProvider.KEY, spotifyApiClient::latestSavedTrack);
        JsonNode items = page == null ? null : page.path("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            return Optional.empty();
        }
        JsonNode saved = items.get(0);
        String id = saved.path("track").path("id").asText(null);
        if (id == null) {
            id = saved.path("id").asText(null);
        }
        return Optional.of(new LatestItem<>(id, saved));
    }

    @Override
    protected Map<String, String> payload(String userId, Map<String, Object> actionConfig, LatestItem<JsonNode> latest) {
        JsonNode track = latest.item().path("track");
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("SPOTIFY_LIKED_SONG_NAME", track.path("name").asText(""));
        payload.put("SPOTIFY_LIKED_SONG_ARTIST", StreamSupport.stream(track.path("artists").spliterator(), false)
                .map(artist -> artist.path("name").asText(""))
                .collect(Collectors.joining(", ")));
        payload.put("SPOTIFY_LIKED_SONG_ALBUM", track.path("album").path("name").asText(""));
        payload.put("SPOTIFY_LIKED_SONG_ALBUM_RELEASE_DATE", track.path("album").path("release_date").asText(""));
        payload.put("SPOTIFY_LIKED_SONG_DURATION_MS", track.path("duration_ms").asText(""));
        payload.put("SPOTIFY_LIKED_SONG_URL", track.path("external_urls").path("spotify").asText(""));
        payload.put("SPOTIFY_LIKED_SONG_ID", latest.id());
        payload.put("SPOTIFY_LIKED_SONG_ADDED_AT", latest.item().path("added_at").asText(""));
        return payload;
    }
}
