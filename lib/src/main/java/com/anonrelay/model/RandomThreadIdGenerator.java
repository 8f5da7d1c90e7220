package com.anonrelay.model;

import java.util.List;
import java.util.Random;

/**
 * Produces ids of the form {@code #<adjective>_<noun>} from two word lists.
 */
public class RandomThreadIdGenerator implements ThreadIdGenerator {

    static final List<String> DEFAULT_ADJECTIVES = List.of(
            "amber", "brave", "calm", "clever", "crimson", "curious", "dusty", "eager", "fancy", "gentle",
            "golden", "happy", "hidden", "jolly", "kind", "lazy", "lucky", "mellow", "misty", "nimble",
            "polite", "proud", "quiet", "rapid", "rusty", "shy", "silent", "silver", "sleepy", "sunny",
            "swift", "tidy", "velvet", "wild", "witty", "young");

    static final List<String> DEFAULT_NOUNS = List.of(
            "badger", "beaver", "comet", "crane", "falcon", "ferret", "fox", "gecko", "hare", "heron",
            "koala", "lantern", "lynx", "marten", "meadow", "moth", "newt", "otter", "owl", "panda",
            "pebble", "puffin", "raven", "river", "robin", "salmon", "seal", "sparrow", "squirrel", "tiger",
            "walrus", "willow", "wolf", "wombat", "yak", "zebra");

    private final List<String> adjectives;
    private final List<String> nouns;
    private final Random random;

    public RandomThreadIdGenerator() {
        this(DEFAULT_ADJECTIVES, DEFAULT_NOUNS, new Random());
    }

    public RandomThreadIdGenerator(List<String> adjectives, List<String> nouns, Random random) {
        if (adjectives.isEmpty() || nouns.isEmpty()) {
            throw new IllegalArgumentException("word lists must not be empty");
        }
        this.adjectives = List.copyOf(adjectives);
        this.nouns = List.copyOf(nouns);
        this.random = random;
    }

    @Override
    public String nextId() {
        return "#" + adjectives.get(random.nextInt(adjectives.size()))
                + "_" + nouns.get(random.nextInt(nouns.size()));
    }
}
