package com.example.comicshelf.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.nsfw")
public class AppNsfwProperties {

    /**
     * Substrings matched against the lowercase category.
     */
    private List<String> categories = new ArrayList<>();

    /**
     * Exact lowercase subcategory values.
     */
    private List<String> subcategories = new ArrayList<>();

    /**
     * Shell-style patterns matched against normalized genres, tags and demographics. Written in
     * normalized form: lower case, last word singular.
     */
    private List<String> tagPatterns = new ArrayList<>(Arrays.asList(
            "adultery", "*breast*", "futanari", "lactation", "pet play", "scissoring", "voyeur",
            "sexual*", "sexless", "yaoi", "yuri", "vore", "armpit", "hypersexuality", "human pet",
            "*chest", "ero guro", "eroge", "rimjob", "deepthroat", "masochism", "facial", "anal*",
            "oral*", "boob*", "group sex", "cheating", "threesome", "smut", "* sex", "sex *",
            "* sex *", "prostitution", "whore", "incest", "fetish", "defloration", "femboy",
            "virginity", "omegaverse", "torture", "masturb*", "handjob", "cunnilingus", "femdom",
            "milf", "fellatio", "* breast", "rape", "slavery", "ecchi", "erotica"));
}
