package com.constraint.config.expression;

import com.constraint.exception.DslSyntaxException;
import com.constraint.exception.UnknownFunctionException;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;
import com.constraint.function.FunctionRegistry;
import com.constraint.variable.DefaultValueResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionParser. Tree shapes are compared through their bracketed string form.
 */
class ExpressionParserTest {

    private FunctionRegistry functions;

    @BeforeEach
    void setUp() {
        functions = new FunctionRegistry();
        functions.register("add", args -> null);
        functions.register("fo", args -> null);
        functions.register("isVip", args -> true);
    }

    private Expression parse(String input) {
        return new ExpressionParser(input, new ExpressionTokenizer(input, functions).tokenize(),
                functions, new DefaultValueResolver()).parse();
    }

    @ParameterizedTest(name = "{0} parses as {1}")
    @CsvSource(delimiterString = "=>", quoteCharacter = '"', value = {
            "1+2*3 => [1 + [2 * 3]]",
            "1*2+3 => [[1 * 2] + 3]",
            "1-2-3 => [[1 - 2] - 3]",
            "8/4/2 => [[8 / 4] / 2]",
            "(1+2)*3 => [([1 + 2]) * 3]",
            "1+2<3*4 => [[1 + 2] < [3 * 4]]",
            "1<2==2>1 => [[1 < 2] == [2 > 1]]",
            "$a==1||$b==2&&$c==3 => [[$a == 1] || [[$b == 2] && [$c == 3]]]",
            "$a||$b||$c => [[$a || $b] || $c]",
            "#x%2!=0 => [[#x % 2] != 0]",
            "isVip&&add(1,$a) => [isVip && add(1, $a)]",
            "'x'+'y' => ['x' + 'y']"
    })
    @DisplayName("Operators bind by precedence and associate left")
    void precedence(String input, String tree) {
        assertEquals(tree, parse(input).toString());
    }

    @Test
    @DisplayName("Function arguments are compiled as full expressions")
    void nestedArguments() {
        Expression expression = parse("add(add(1,2*3),'a,b')");

        assertEquals(ExpressionType.FUNCTION_CALL, expression.getType());
        assertEquals("add(add(1, [2 * 3]), 'a,b')", expression.toString());
    }

    @Test
    @DisplayName("Function without arguments")
    void noArguments() {
        assertEquals("add()", parse("add()").toString());
    }

    @Test
    @DisplayName("Name sharing only a prefix with a registered function is unknown")
    void unknownFunction() {
        UnknownFunctionException e = assertThrows(UnknownFunctionException.class, () -> parse("foo(1)"));
        assertEquals("foo", e.getFunctionName());

        assertThrows(UnknownFunctionException.class, () -> parse("isVipX"));
    }

    @Test
    @DisplayName("Dangling operator reports the end of the expression")
    void danglingOperator() {
        DslSyntaxException e = assertThrows(DslSyntaxException.class, () -> parse("1+"));
        assertEquals(2, e.getPosition());
        assertTrue(e.getMessage().contains("Unexpected end of expression"));
    }

    @Test
    @DisplayName("Unclosed group reports where the bracket was expected")
    void unclosedGroup() {
        DslSyntaxException e = assertThrows(DslSyntaxException.class, () -> parse("(1+2"));
        assertEquals(4, e.getPosition());
    }

    @Test
    @DisplayName("Surplus closing bracket is rejected")
    void surplusClosingBracket() {
        DslSyntaxException e = assertThrows(DslSyntaxException.class, () -> parse("1)"));
        assertEquals(1, e.getPosition());
    }

    @Test
    @DisplayName("Two operands without an operator are rejected")
    void missingOperator() {
        assertThrows(DslSyntaxException.class, () -> parse("$a'b'"));
    }

    @Test
    @DisplayName("Empty argument is rejected")
    void emptyArgument() {
        assertThrows(DslSyntaxException.class, () -> parse("add(1,,2)"));
    }
}
