package org.ndlkit.script.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The ordered table of built-in NDL functions. Lookups use the {@link NameMatcher} abbreviation
 * rule, so the order of registration decides ambiguous prefixes.
 */
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final List<FunctionDefinition> functions = new ArrayList<>();

    /**
     * Registers a function definition.
     * @param definition The definition to add.
     * @throws IllegalArgumentException if the name or alias is already taken.
     */
    public void register(FunctionDefinition definition) {
        for (FunctionDefinition existing : functions) {
            if (NameMatcher.isExact(definition.name(), existing.name(), existing.alias())
                    || (definition.alias() != null && NameMatcher.isExact(definition.alias(), existing.name(), existing.alias()))) {
                throw new IllegalArgumentException("Function already registered: " + definition.name());
            }
        }
        functions.add(definition);
        log.trace("Registered function {}", definition.name());
    }

    /**
     * Resolves a (possibly abbreviated) function name.
     * @param token The name as written in the script.
     * @return The matched definition, or empty.
     */
    public Optional<FunctionDefinition> find(String token) {
        return NameMatcher.find(token, functions, FunctionDefinition::name, FunctionDefinition::alias);
    }

    /**
     * Checks for a function whose name or alias equals the token exactly (ignoring case).
     * @param token The name to test.
     * @return The definition, or empty.
     */
    public Optional<FunctionDefinition> findExact(String token) {
        for (FunctionDefinition definition : functions) {
            if (NameMatcher.isExact(token, definition.name(), definition.alias())) {
                return Optional.of(definition);
            }
        }
        return Optional.empty();
    }

    /**
     * @return All registered definitions in table order.
     */
    public List<FunctionDefinition> all() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * Creates the registry holding the standard function vocabulary.
     * @return A new, populated registry.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(new FunctionDefinition("Input", "InputValue", List.of("rows", "cols"), 1, false));
        registry.register(new FunctionDefinition("SparseInput", "SparseInputValue", List.of("rows", "cols"), 1, false));
        registry.register(new FunctionDefinition("ImageInput", null, List.of("width", "height", "channels", "numImages"), 3, false));
        registry.register(new FunctionDefinition("LearnableParameter", "Parameter", List.of("rows", "cols"), 2, true));
        registry.register(new FunctionDefinition("Constant", null, List.of("value", "rows", "cols"), 1, false));

        for (String binary : List.of("Plus", "Minus", "Times", "ElementTimes", "DiagTimes", "Scale",
                "CosDistance", "KhatriRaoProduct", "SquareError")) {
            registry.register(binary(binary, null));
        }
        registry.register(binary("CrossEntropyWithSoftmax", "CrossEntropy"));
        registry.register(binary("ClassificationError", "ErrorPrediction"));

        for (String unary : List.of("Negate", "Sigmoid", "Tanh")) {
            registry.register(unary(unary, null));
        }
        registry.register(unary("RectifiedLinear", "ReLU"));
        for (String unary : List.of("Log", "Exp", "Cos", "Softmax", "LogSoftmax", "SumElements",
                "Transpose", "Dropout", "Mean", "InvStdDev")) {
            registry.register(unary(unary, null));
        }

        registry.register(new FunctionDefinition("PerDimMeanVarNormalization", "PerDimMVNorm",
                List.of("@input", "@mean", "@invStdDev"), 3, false));
        registry.register(new FunctionDefinition("Convolution", null,
                List.of("@weights", "@input", "kernelWidth", "kernelHeight", "outputChannels",
                        "horizontalSubsample", "verticalSubsample"), 7, false));
        for (String pooling : List.of("MaxPooling", "AveragePooling")) {
            registry.register(new FunctionDefinition(pooling, null,
                    List.of("@input", "windowWidth", "windowHeight", "horizontalSubsample", "verticalSubsample"), 5, false));
        }
        registry.register(new FunctionDefinition("PastValue", "Delay", List.of("rows", "cols", "@input"), 3, false));
        registry.register(new FunctionDefinition("RowSlice", null, List.of("startIndex", "numRows", "@input"), 3, false));
        registry.register(new FunctionDefinition("Reshape", null, List.of("@input", "numRows"), 2, false));
        return registry;
    }

    private static FunctionDefinition binary(String name, String alias) {
        return new FunctionDefinition(name, alias, List.of("@left", "@right"), 2, false);
    }

    private static FunctionDefinition unary(String name, String alias) {
        return new FunctionDefinition(name, alias, List.of("@input"), 1, false);
    }
}
