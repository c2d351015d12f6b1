package com.viffx.WhileLang.Compiler;

public enum ActionType {
    SHIFT,
    REDUCE,
    ACCEPT
}
