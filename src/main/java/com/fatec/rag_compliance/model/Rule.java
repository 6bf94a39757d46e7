package com.fatec.rag_compliance.model;

import java.util.Objects;

/**
 * One compliance rule as loaded from the rule store. Read-only once it is part
 * of a retriever snapshot.
 */
public final class Rule {
    private final long id;
    private final String name;
    private final String content;
    private final String category;

    public Rule(long id, String name, String content, String category) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.content = content == null ? "" : content;
        this.category = category;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    /**
     * Discipline or domain tag such as "PT", "OT", "SLP"; may be {@code null}.
     */
    public String getCategory() {
        return category;
    }

    /**
     * Text indexed by both the lexical and the dense index.
     */
    public String toCorpusText() {
        return name + ". " + content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rule)) {
            return false;
        }
        Rule other = (Rule) o;
        return id == other.id
                && name.equals(other.name)
                && content.equals(other.content)
                && Objects.equals(category, other.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, content, category);
    }

    @Override
    public String toString() {
        return "Rule{id=" + id + ", name='" + name + "', category=" + category + "}";
    }
}
