package com.yahtzeegame.scoring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable rule catalog: the ordered categories of a game plus the options that pick
 * between rule variants. Build one at startup and pass it to whatever scores.
 */
public final class ScoringRules {

    private static final ScoringRules STANDARD = of(RuleOptions.defaults());

    private final List<Category> categories;
    private final Map<String, Category> byId;
    private final RuleOptions options;
    private final Category yahtzee;

    public ScoringRules(List<Category> categories, RuleOptions options) {
        Objects.requireNonNull(categories, "categories");
        this.options = Objects.requireNonNull(options, "options");

        Map<String, Category> index = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (Category category : categories) {
            if (index.putIfAbsent(category.getId(), category) != null) {
                duplicates.add(category.getId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Categories cannot share ids. Duplicate ids are: " + duplicates);
        }

        this.categories = List.copyOf(categories);
        this.byId = Collections.unmodifiableMap(index);
        this.yahtzee = categories.stream()
                .filter(c -> c.getKind() == Category.Kind.FIXED && c.getPattern() == Pattern.FIVE_OF_A_KIND)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("A rule catalog needs a five-of-a-kind category"));
    }

    /**
     * Standard categories with default options.
     */
    public static ScoringRules standard() {
        return STANDARD;
    }

    /**
     * Standard categories with the given options.
     */
    public static ScoringRules of(RuleOptions options) {
        return new ScoringRules(DefaultRules.categories(options), options);
    }

    public List<Category> getCategories() {
        return categories;
    }

    public List<Category> categories(Section section) {
        return categories.stream()
                .filter(c -> c.getSection() == section)
                .collect(Collectors.toList());
    }

    public RuleOptions getOptions() {
        return options;
    }

    /**
     * @throws UnknownCategoryException if no category has the id
     */
    public Category category(String id) {
        Category category = id == null ? null : byId.get(id);
        if (category == null) {
            throw new UnknownCategoryException(id);
        }
        return category;
    }

    public Optional<Category> findCategory(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    public Category yahtzeeCategory() {
        return yahtzee;
    }

    /**
     * The upper-section box counting the given face, if the catalog has one.
     */
    public Optional<Category> upperCategoryFor(int face) {
        return categories.stream()
                .filter(c -> c.getKind() == Category.Kind.FACE && c.getFaceValue() == face)
                .findFirst();
    }
}
