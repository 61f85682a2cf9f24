package com.github.trex_paxos.binexport;

/// Ties an (instruction, operand, expression) position to a de-duped string in the string
/// table. Used for string references, expression substitutions and legacy address comments.
///
/// @param instructionIndex         index into the instruction table
/// @param instructionOperandIndex  position in the instruction's operand list
/// @param operandExpressionIndex   position in the operand's expression list
/// @param stringTableIndex         index into the string table
public record Reference(
    int instructionIndex,
    int instructionOperandIndex,
    int operandExpressionIndex,
    int stringTableIndex) {
}
