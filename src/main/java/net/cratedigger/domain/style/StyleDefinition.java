package net.cratedigger.domain.style;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import net.cratedigger.util.StyleSlugs;

/**
 * A named musical style with alternative spellings and an optional parent style slug.
 */
public record StyleDefinition(String name, List<String> aliases, String parent) {

    public StyleDefinition {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    @JsonIgnore
    public String slug() {
        return StyleSlugs.slugify(name);
    }
}
