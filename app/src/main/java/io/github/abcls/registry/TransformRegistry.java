package io.github.abcls.registry;

import io.github.abcls.parser.AbcContext;
import io.github.abcls.selection.Selection;
import io.github.abcls.transforms.AddVoice;
import io.github.abcls.transforms.Harmonize;
import io.github.abcls.transforms.PitchTransforms;
import io.github.abcls.transforms.RestTransforms;
import io.github.abcls.transforms.RhythmTransforms;
import io.github.abcls.transforms.StructuralTransforms;
import io.github.abcls.transforms.VoiceParams;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Transforms that requests may name, with the number of arguments each accepts. */
public final class TransformRegistry {
    @FunctionalInterface
    public interface TransformFn {
        Selection apply(Selection selection, AbcContext ctx, List<?> args);
    }

    public record Entry(String name, int minArgs, int maxArgs, TransformFn fn) {
        /** @throws IllegalArgumentException if {@code args} has the wrong length or types */
        public Selection invoke(Selection selection, AbcContext ctx, List<?> args) {
            Arity.check(name, minArgs, maxArgs, args);
            return fn.apply(selection, ctx, args);
        }
    }

    private static final Map<String, Entry> ENTRIES = new LinkedHashMap<>();

    static {
        register("transpose", 1, 1, (sel, ctx, args) ->
                PitchTransforms.transpose(sel, ctx, Args.intArg(args, 0, "semitones")));
        register("octave", 1, 1, (sel, ctx, args) ->
                PitchTransforms.octave(sel, ctx, Args.intArg(args, 0, "octaves")));
        register("enharmonize", 0, 0, (sel, ctx, args) -> PitchTransforms.enharmonize(sel, ctx));
        register("harmonize", 1, 1, (sel, ctx, args) ->
                Harmonize.harmonize(sel, ctx, Args.intArg(args, 0, "steps")));
        register("setRhythm", 1, 2, (sel, ctx, args) ->
                RhythmTransforms.setRhythm(sel, ctx, Args.rationalArg(args, "rhythm")));
        register("addToRhythm", 1, 2, (sel, ctx, args) ->
                RhythmTransforms.addToRhythm(sel, ctx, Args.rationalArg(args, "rhythm")));
        register("multiplyRhythm", 0, 1, (sel, ctx, args) -> RhythmTransforms.multiplyRhythm(
                sel, ctx, Args.intArg(args, 0, "factor", RhythmTransforms.DEFAULT_FACTOR)));
        register("divideRhythm", 0, 1, (sel, ctx, args) -> RhythmTransforms.divideRhythm(
                sel, ctx, Args.intArg(args, 0, "factor", RhythmTransforms.DEFAULT_FACTOR)));
        register("toRest", 0, 0, (sel, ctx, args) -> StructuralTransforms.toRest(sel, ctx));
        register("unwrapSingle", 0, 0, (sel, ctx, args) -> StructuralTransforms.unwrapSingle(sel, ctx));
        register("remove", 0, 0, (sel, ctx, args) -> StructuralTransforms.remove(sel));
        register("consolidateRests", 0, 0, (sel, ctx, args) -> RestTransforms.consolidateRests(sel, ctx));
        register("legato", 0, 0, (sel, ctx, args) -> RestTransforms.legato(sel, ctx));
        register("addVoice", 1, 4, (sel, ctx, args) -> AddVoice.addVoice(
                sel,
                ctx,
                Args.stringArg(args, 0, "voice id"),
                VoiceParams.parse(Args.stringArgs(args, 1, "voice property"))));
    }

    private TransformRegistry() {
        // utility
    }

    private static void register(String name, int minArgs, int maxArgs, TransformFn fn) {
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
