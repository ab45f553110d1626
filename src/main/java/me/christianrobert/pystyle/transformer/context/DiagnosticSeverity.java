package me.christianrobert.pystyle.transformer.context;

public enum DiagnosticSeverity {
    INFO,
    WARNING,
    ERROR
}
