package DFAMin.Validation;

public enum Severity {
    ERROR,
    WARNING
}
