package io.github.abcls.registry;

import io.github.abcls.selection.Selection;
import io.github.abcls.selectors.ChordSelectors;
import io.github.abcls.selectors.DelimiterSelectors;
import io.github.abcls.selectors.StructuralSelectors;
import io.github.abcls.selectors.TypeSelectors;
import io.github.abcls.selectors.VoiceSelectors;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/** Selectors that requests may name, with the number of arguments each accepts. */
public final class SelectorRegistry {
    @FunctionalInterface
    public interface SelectorFn {
        Selection apply(Selection selection, List<?> args);
    }

    public record Entry(String name, int minArgs, int maxArgs, SelectorFn fn) {
        /** @throws IllegalArgumentException if {@code args} has the wrong length or types */
        public Selection invoke(Selection selection, List<?> args) {
            Arity.check(name, minArgs, maxArgs, args);
            return fn.apply(selection, args);
        }
    }

    private static final Map<String, Entry> ENTRIES = new LinkedHashMap<>();

    static {
        plain("selectChords", TypeSelectors::selectChords);
        plain("selectNotes", TypeSelectors::selectNotes);
        plain("selectRests", TypeSelectors::selectRests);
        plain("selectNonChordNotes", TypeSelectors::selectNonChordNotes);
        plain("selectChordNotes", TypeSelectors::selectChordNotes);
        plain("selectTune", StructuralSelectors::selectTune);
        plain("selectSystem", StructuralSelectors::selectSystem);
        register("selectMeasures", 0, 2, SelectorRegistry::selectMeasures);
        register(
                "selectVoices",
                1,
                1,
                (selection, args) -> VoiceSelectors.selectVoices(selection, Args.stringArg(args, 0, "voice id")));
        plain("selectTop", ChordSelectors::selectTop);
        plain("selectBottom", ChordSelectors::selectBottom);
        plain("selectAllButTop", ChordSelectors::selectAllButTop);
        plain("selectAllButBottom", ChordSelectors::selectAllButBottom);
        register(
                "selectNthFromTop",
                1,
                1,
                (selection, args) -> ChordSelectors.selectNthFromTop(selection, Args.intArg(args, 0, "n")));
        plain("selectInsideChord", DelimiterSelectors::selectInsideChord);
        plain("selectAroundChord", DelimiterSelectors::selectAroundChord);
        plain("selectInsideGraceGroup", DelimiterSelectors::selectInsideGraceGroup);
        plain("selectAroundGraceGroup", DelimiterSelectors::selectAroundGraceGroup);
        plain("selectInsideInlineField", DelimiterSelectors::selectInsideInlineField);
        plain("selectAroundInlineField", DelimiterSelectors::selectAroundInlineField);
        plain("selectInsideGrouping", DelimiterSelectors::selectInsideGrouping);
        plain("selectAroundGrouping", DelimiterSelectors::selectAroundGrouping);
    }

    private SelectorRegistry() {
        // utility
    }

    /** No arguments selects every measure, one selects that measure, two select an inclusive range. */
    private static Selection selectMeasures(Selection selection, List<?> args) {
        if (args.isEmpty()) {
            return StructuralSelectors.selectMeasures(selection);
        }
        int start = Args.intArg(args, 0, "start");
        int end = Args.intArg(args, 1, "end", start);
        return StructuralSelectors.selectMeasures(selection, start, end);
    }

    private static void plain(String name, UnaryOperator<Selection> selector) {
        register(name, 0, 0, (selection, args) -> selector.apply(selection));
    }

    private static void register(String name, int minArgs, int maxArgs, SelectorFn fn) {
        ENTRIES.put(name, new Entry(name, minArgs, maxArgs, fn));
    }

    public static Optional<Entry> lookup(String name) {
        return Optional.ofNullable(ENTRIES.get(name));
    }

    /** Registered names in registration order. */
    public static Set<String> names() {
        return Collections.unmodifiableSet(ENTRIES.keySet());
    }
}
