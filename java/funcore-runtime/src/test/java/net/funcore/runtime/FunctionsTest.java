package net.funcore.runtime;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

public class FunctionsTest {
    private static final Function<Integer, Integer> INCREMENT = x -> x + 1;
    private static final Function<Integer, Integer> DOUBLE = x -> x * 2;
    private static final Function<Integer, String> DESCRIBE = x -> "n=" + x;
    private static final Function<String, Integer> LENGTH = String::length;
    private static final Function<Integer, Boolean> IS_EVEN = x -> x % 2 == 0;

    private static final List<Integer> INPUTS = Arrays.asList(-100, -1, 0, 3, 42, 12345);

    @Test
    public void testPipeAppliesLeftToRight() {
        Assert.assertEquals(8, (int) Functions.pipe(INCREMENT, DOUBLE).apply(3));
    }

    @Test
    public void testComposeAppliesSecondArgumentFirst() {
        Assert.assertEquals(7, (int) Functions.compose(INCREMENT, DOUBLE).apply(3));
        Assert.assertEquals(Integer.valueOf(4), Functions.compose(LENGTH, DESCRIBE).apply(42));
    }

    @Test
    public void testEmptyPipeIsIdentity() {
        Function<String, String> identity = Functions.pipe();
        Assert.assertEquals("unchanged", identity.apply("unchanged"));
        Assert.assertEquals(5, (int) Functions.<Integer>pipe().apply(5));
    }

    @Test
    public void testSingleFunctionPipeIsThatFunction() {
        Assert.assertSame(INCREMENT, Functions.pipe(INCREMENT));
    }

    @Test
    public void testPipeAssociativity() {
        Function<Integer, Boolean> flat = Functions.pipe(DESCRIBE, LENGTH, IS_EVEN);
        Function<Integer, Boolean> leftGrouped = Functions.pipe(Functions.pipe(DESCRIBE, LENGTH), IS_EVEN);
        Function<Integer, Boolean> rightGrouped = Functions.pipe(DESCRIBE, Functions.pipe(LENGTH, IS_EVEN));
        for (int x : INPUTS) {
            Assert.assertEquals(flat.apply(x), leftGrouped.apply(x));
            Assert.assertEquals(flat.apply(x), rightGrouped.apply(x));
        }
    }

    @Test
    public void testLongPipes() {
        // 0 -> 1 -> 2 -> 3 -> "n=3" -> 3 -> false
        Assert.assertEquals(Boolean.FALSE, Functions.pipe(INCREMENT, DOUBLE, INCREMENT, DESCRIBE, LENGTH, IS_EVEN)
                .apply(0));
        Assert.assertEquals("n=7", Functions.pipe(INCREMENT, INCREMENT, DOUBLE, INCREMENT, DESCRIBE).apply(1));
        Assert.assertEquals(4, (int) Functions.pipe(INCREMENT, DOUBLE, DESCRIBE, LENGTH).apply(4));
    }

    @Test
    public void testPipeOverMaybeReturningFunctions() {
        Function<String, Maybe<Integer>> parse = s -> s.matches("-?\\d+")
                ? Maybe.present(Integer.parseInt(s))
                : Maybe.<Integer>absent();
        Function<Maybe<Integer>, Maybe<Integer>> halve = m -> m.andThen(
                x -> x % 2 == 0 ? Maybe.present(x / 2) : Maybe.<Integer>absent());
        Function<Maybe<Integer>, Integer> orZero = m -> m.getOrElse(0);

        Function<String, Integer> pipeline = Functions.pipe(parse, halve, orZero);
        Assert.assertEquals(21, (int) pipeline.apply("42"));
        Assert.assertEquals(0, (int) pipeline.apply("7"));
        Assert.assertEquals(0, (int) pipeline.apply("seven"));
    }

    @Test
    public void testPipeAll() {
        Function<String, String> appendA = s -> s + "a";
        Function<String, String> appendB = s -> s + "b";
        Assert.assertEquals("xab", Functions.pipeAll(appendA, appendB).apply("x"));
        Assert.assertEquals("xba", Functions.pipeAll(Arrays.asList(appendB, appendA)).apply("x"));
        Assert.assertEquals("x", Functions.pipeAll(Collections.<Function<String, String>>emptyList()).apply("x"));
    }

    @Test
    public void testPipeAllCopiesItsInput() {
        List<Function<Integer, Integer>> steps = new ArrayList<>();
        steps.add(INCREMENT);
        Function<Integer, Integer> pipeline = Functions.pipeAll(steps);
        steps.add(DOUBLE);
        Assert.assertEquals(2, (int) pipeline.apply(1));
    }

    @Test
    public void testConstantAndFlip() {
        Assert.assertEquals("fixed", Functions.<Integer, String>constant("fixed").apply(99));
        BiFunction<Integer, Integer, Integer> subtract = (a, b) -> a - b;
        Assert.assertEquals(7, (int) Functions.flip(subtract).apply(3, 10));
    }

    @Test
    public void testPartialOfBiFunction() {
        BiFunction<String, Integer, String> repeat = (s, n) -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < n; i++) {
                sb.append(s);
            }
            return sb.toString();
        };
        Function<Integer, String> repeatAb = Functions.partial(repeat, "ab");
        Assert.assertEquals("ababab", repeatAb.apply(3));
        Assert.assertEquals("", repeatAb.apply(0));
    }

    @Test
    public void testPartialOfFunction3() {
        Function3<Integer, Integer, Integer, Integer> affine = (a, x, b) -> a * x + b;
        BiFunction<Integer, Integer, Integer> triple = Functions.partial(affine, 3);
        Function<Integer, Integer> tripleMinusOne = Functions.partial(affine, 3, 5);
        Assert.assertEquals(11, (int) triple.apply(4, -1));
        Assert.assertEquals(14, (int) tripleMinusOne.apply(-1));
    }

    @Test
    public void testPartialOfFunction4() {
        Function4<String, String, String, String, String> join = (a, b, c, d) -> a + b + c + d;
        Assert.assertEquals("wxyz", Functions.partial(join, "w").apply("x", "y", "z"));
        Assert.assertEquals("wxyz", Functions.partial(join, "w", "x").apply("y", "z"));
        Assert.assertEquals("wxyz", Functions.partial(join, "w", "x", "y").apply("z"));
    }

    @Test
    public void testVariadicPartialConcatenatesArguments() {
        VariadicFunction<String> joinAll = args -> Arrays.toString(args);
        VariadicFunction<String> withPrefix = Functions.partial(joinAll, "a", "b");
        Assert.assertEquals("[a, b, c]", withPrefix.apply("c"));
        Assert.assertEquals("[a, b]", withPrefix.apply());
        Assert.assertEquals("[a, b, c, d, e]", withPrefix.apply("c", "d", "e"));
    }

    @Test
    public void testVariadicPartialRejectsNullArgumentArray() {
        VariadicFunction<Integer> count = args -> args.length;
        VariadicFunction<Integer> withPrefix = Functions.partial(count, "a");
        Assert.assertEquals(2, (int) withPrefix.apply((Object) null));
        try {
            withPrefix.apply((Object[]) null);
            Assert.fail("Expected a NullPointerException");
        } catch (NullPointerException e) {
            Assert.assertEquals("Argument array may not be null", e.getMessage());
        }
    }
}
