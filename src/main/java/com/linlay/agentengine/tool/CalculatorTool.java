package com.linlay.agentengine.tool;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;

@Component
public class CalculatorTool implements BaseTool {

    @Override
    public String name() {
        return "calculator";
    }

    @Override
    public String description() {
        return "Applies add, subtract, multiply or divide to two numbers.";
    }

    @Override
    public ToolParameterSchema parametersSchema() {
        return ToolParameterSchema.builder()
                .required("operation", "string", "add, subtract, multiply or divide")
                .required("a", "number", "Left operand")
                .required("b", "number", "Right operand")
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        BigDecimal a;
        BigDecimal b;
        try {
            a = new BigDecimal(String.valueOf(parameters.get("a")).trim());
            b = new BigDecimal(String.valueOf(parameters.get("b")).trim());
        } catch (NumberFormatException ex) {
            return ToolResult.failure("Operands must be numbers");
        }
        String operation = String.valueOf(parameters.get("operation")).trim().toLowerCase(Locale.ROOT);
        BigDecimal result;
        switch (operation) {
            case "add" -> result = a.add(b);
            case "subtract" -> result = a.subtract(b);
            case "multiply" -> result = a.multiply(b);
            case "divide" -> {
                if (b.signum() == 0) {
                    return ToolResult.failure("Division by zero");
                }
                result = a.divide(b, MathContext.DECIMAL64);
            }
            default -> {
                return ToolResult.failure("Unsupported operation: " + operation);
            }
        }
        String text = result.stripTrailingZeros().toPlainString();
        return ToolResult.success(text, Map.of("result", text));
    }
}
