package p8lua.ast.stmt;

import p8lua.ast.Node;

public sealed interface Stmt extends Node
        permits AssignStmt, CallStmt, DoStmt, WhileStmt, RepeatStmt, IfStmt,
        ForNumStmt, ForInStmt, FunctionStmt, LocalFunctionStmt, LocalAssignStmt,
        BreakStmt, ReturnStmt, GotoStmt, LabelStmt, EmptyStmt, PrintStmt {}
