package io.surfworks.tessera.ir.contract;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.surfworks.tessera.ir.UnresolvedDomainException;
import io.surfworks.tessera.types.ElementType;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps type-domain ids ({@code "T"}, {@code "T_INT"}, ...) to the element types they accept.
 *
 * <p>A registry is built once per graph-building session and passed to every
 * operation node that needs it; there is no global instance.
 *
 * <p>The JSON form has one object of domains:
 * <pre>{@code
 * { "domains": { "T": ["fp16", "fp32", "int32"], "T_BOOL": ["bool"] } }
 * }</pre>
 */
public final class TypeDomainRegistry {

    /** Classpath location of the bundled domain definitions. */
    public static final String DEFAULT_RESOURCE = "/io/surfworks/tessera/type-domains.json";

    private static final Gson GSON = new Gson();

    private final Map<String, Set<ElementType>> domains;

    private TypeDomainRegistry(Map<String, Set<ElementType>> domains) {
        this.domains = domains;
    }

    /**
     * Loads the domain definitions bundled with this library.
     */
    public static TypeDomainRegistry defaults() {
        try (InputStream in = TypeDomainRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parses domain definitions from JSON.
     *
     * @throws IllegalArgumentException if the document is malformed or names an unknown element type
     */
    public static TypeDomainRegistry load(Reader reader) {
        JsonObject root;
        try {
            root = GSON.fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed type-domain document", e);
        }
        if (root == null || !root.has("domains") || !root.get("domains").isJsonObject()) {
            throw new IllegalArgumentException("Type-domain document must contain a \"domains\" object");
        }
        Builder builder = builder();
        for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("domains").entrySet()) {
            if (!entry.getValue().isJsonArray()) {
                throw new IllegalArgumentException("Domain " + entry.getKey() + " must be an array of type names");
            }
            Set<ElementType> types = EnumSet.noneOf(ElementType.class);
            for (JsonElement name : entry.getValue().getAsJsonArray()) {
                types.add(ElementType.of(name.getAsString()));
            }
            builder.domain(entry.getKey(), types);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accepted element types of {@code domainId}.
     *
     * @throws UnresolvedDomainException if the id is not defined
     */
    public Set<ElementType> resolve(String domainId) {
        return find(domainId).orElseThrow(() -> new UnresolvedDomainException(domainId));
    }

    public Optional<Set<ElementType>> find(String domainId) {
        return Optional.ofNullable(domains.get(domainId));
    }

    public boolean contains(String domainId) {
        return domains.containsKey(domainId);
    }

    public Set<String> domainIds() {
        return Collections.unmodifiableSet(domains.keySet());
    }

    @Override
    public String toString() {
        return "TypeDomainRegistry" + domains;
    }

    public static final class Builder {
        private final Map<String, Set<ElementType>> domains = new LinkedHashMap<>();

        private Builder() {}

        public Builder domain(String id, Set<ElementType> types) {
            if (types.isEmpty()) {
                throw new IllegalArgumentException("Domain " + id + " must accept at least one element type");
            }
            domains.put(id, Collections.unmodifiableSet(EnumSet.copyOf(types)));
            return this;
        }

        public Builder domain(String id, ElementType first, ElementType... rest) {
            return domain(id, EnumSet.of(first, rest));
        }

        public TypeDomainRegistry build() {
            return new TypeDomainRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(domains)));
        }
    }
}
