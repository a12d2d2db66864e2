package com.mollang.playground.compiler.codegen;

/**
 * C++ support code placed at the top of every generated program.
 */
final class CppRuntime {

    static final String VALUE_TYPE = "MolObject";
    static final String PRINT = "mollang_print";
    static final String INPUT = "mollang_input";
    static final String CONDITION = "mollang_condition";
    static final String RUNTIME_ERROR = "MolRuntimeError";

    static final String PREAMBLE = """
            #include <cctype>
            #include <cstddef>
            #include <iostream>
            #include <stdexcept>
            #include <string>
            #include <variant>

            struct MolRuntimeError : std::runtime_error {
                explicit MolRuntimeError(const std::string& message) : std::runtime_error(message) {}
            };

            struct MolObject {
                std::variant<std::monostate, int, std::string, bool> value;

                MolObject() : value(std::monostate{}) {}
                MolObject(int v) : value(v) {}
                MolObject(const std::string& v) : value(v) {}
                MolObject(const char* v) : value(std::string(v)) {}
                MolObject(bool v) : value(v) {}
            };

            MolObject operator+(const MolObject& a, const MolObject& b) {
                if (std::holds_alternative<int>(a.value) && std::holds_alternative<int>(b.value)) {
                    return MolObject(std::get<int>(a.value) + std::get<int>(b.value));
                }
                if (std::holds_alternative<std::string>(a.value) && std::holds_alternative<std::string>(b.value)) {
                    return MolObject(std::get<std::string>(a.value) + std::get<std::string>(b.value));
                }
                throw MolRuntimeError("Unsupported operand types for +");
            }

            MolObject operator*(const MolObject& a, const MolObject& b) {
                if (std::holds_alternative<std::string>(a.value) && std::holds_alternative<int>(b.value)) {
                    std::string repeated;
                    for (int i = 0; i < std::get<int>(b.value); ++i) {
                        repeated += std::get<std::string>(a.value);
                    }
                    return MolObject(repeated);
                }
                if (std::holds_alternative<int>(a.value) && std::holds_alternative<int>(b.value)) {
                    return MolObject(std::get<int>(a.value) * std::get<int>(b.value));
                }
                throw MolRuntimeError("Unsupported operand types for *");
            }

            MolObject operator<(const MolObject& a, const MolObject& b) {
                if (std::holds_alternative<int>(a.value) && std::holds_alternative<int>(b.value)) {
                    return MolObject(std::get<int>(a.value) < std::get<int>(b.value));
                }
                throw MolRuntimeError("Unsupported operand types for <");
            }

            MolObject operator<=(const MolObject& a, const MolObject& b) {
                if (std::holds_alternative<int>(a.value) && std::holds_alternative<int>(b.value)) {
                    return MolObject(std::get<int>(a.value) <= std::get<int>(b.value));
                }
                throw MolRuntimeError("Unsupported operand types for <=");
            }

            MolObject operator==(const MolObject& a, const MolObject& b) {
                if (std::holds_alternative<int>(a.value) && std::holds_alternative<int>(b.value)) {
                    return MolObject(std::get<int>(a.value) == std::get<int>(b.value));
                }
                if (std::holds_alternative<std::string>(a.value) && std::holds_alternative<std::string>(b.value)) {
                    return MolObject(std::get<std::string>(a.value) == std::get<std::string>(b.value));
                }
                return MolObject(false);
            }

            bool mollang_condition(const MolObject& obj) {
                if (!std::holds_alternative<bool>(obj.value)) {
                    throw MolRuntimeError("Condition is not a boolean");
                }
                return std::get<bool>(obj.value);
            }

            void mollang_print(const MolObject& obj) {
                if (std::holds_alternative<int>(obj.value)) {
                    std::cout << std::get<int>(obj.value);
                } else if (std::holds_alternative<std::string>(obj.value)) {
                    std::cout << std::get<std::string>(obj.value);
                } else if (std::holds_alternative<bool>(obj.value)) {
                    std::cout << (std::get<bool>(obj.value) ? "true" : "false");
                }
                std::cout << std::endl;
            }

            MolObject mollang_input() {
                std::string line;
                if (!std::getline(std::cin, line)) {
                    return MolObject(std::string());
                }
                if (!line.empty() && line.back() == '\\r') {
                    line.pop_back();
                }
                std::size_t start = (!line.empty() && (line[0] == '+' || line[0] == '-')) ? 1 : 0;
                bool digits = line.size() > start;
                for (std::size_t i = start; i < line.size(); ++i) {
                    digits = digits && std::isdigit(static_cast<unsigned char>(line[i]));
                }
                if (digits) {
                    try {
                        return MolObject(std::stoi(line));
                    } catch (const std::out_of_range&) {
                        return MolObject(line);
                    }
                }
                return MolObject(line);
            }
            """;

    private CppRuntime() {
    }
}
