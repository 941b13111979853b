package org.zeno.compiler.diagnostics;

/**
 * Catalog of compiler error messages. Each entry has an English primary template
 * and a Japanese companion template; both use {@link String#format} placeholders.
 */
public enum Messages {
    // Parser
    EXPECTED_TOKEN(
            "expected next token to be %s, got %s instead",
            "次のトークンは %s であるべきですが、%s が見つかりました"),
    NO_PREFIX_PARSE(
            "no prefix parse function for %s found",
            "%s に対応する前置解析関数が見つかりません"),
    UNCLOSED_BLOCK(
            "expected '}' to close block",
            "ブロックを閉じる '}' が必要です"),
    ILLEGAL_TOKEN(
            "illegal token '%s'",
            "不正なトークン '%s' です"),
    INVALID_INTEGER(
            "could not parse '%s' as integer",
            "'%s' を整数として解析できません"),
    INVALID_FLOAT(
            "could not parse '%s' as float",
            "'%s' を浮動小数点数として解析できません"),
    VARIADIC_NOT_LAST(
            "variadic parameter must be the last parameter",
            "可変長引数は最後の引数でなければなりません"),
    PUB_WITHOUT_FN(
            "pub can only be used with function definitions",
            "pub は関数定義にのみ使用できます"),

    // Generator
    MODULE_READ_FAILED(
            "Failed to read module file %s: %s",
            "モジュールファイル %s を読み込めませんでした: %s"),
    MODULE_PARSE_ERRORS(
            "Parse errors in module %s: %s",
            "モジュール %s に構文エラーがあります: %s"),
    NOT_EXPORTED(
            "Function '%s' is not exported from module '%s'",
            "関数 '%s' はモジュール '%s' から公開されていません"),
    UNKNOWN_STD_MODULE(
            "unknown standard library module '%s'",
            "標準ライブラリモジュール '%s' は存在しません"),
    UNKNOWN_MODULE(
            "cannot resolve module '%s'",
            "モジュール '%s' を解決できません"),
    CIRCULAR_IMPORT(
            "circular import detected: %s",
            "循環インポートが検出されました: %s"),
    DUPLICATE_IMPORT(
            "symbol '%s' is already imported",
            "シンボル '%s' は既にインポートされています"),
    UNDEFINED_FUNCTION(
            "Function '%s' is not defined or imported",
            "関数 '%s' は定義もインポートもされていません"),
    UNDEFINED_IDENTIFIER(
            "Undefined identifier '%s'",
            "識別子 '%s' は定義されていません"),
    PARAMETER_TYPE_REQUIRED(
            "parameter '%s' of function '%s' must have an explicit type",
            "関数 '%2$s' の引数 '%1$s' には型の明示が必要です"),
    RETURN_TYPE_REQUIRED(
            "function '%s' returns a value but declares no return type",
            "関数 '%s' は値を返しますが戻り値の型が宣言されていません"),
    UNKNOWN_TYPE(
            "unknown type '%s'",
            "不明な型 '%s' です"),
    ASSIGN_TO_IMMUTABLE(
            "cannot assign to immutable variable '%s'",
            "不変変数 '%s' には代入できません"),
    ASSIGN_TO_UNDECLARED(
            "cannot assign to undeclared variable '%s'",
            "宣言されていない変数 '%s' には代入できません"),
    REQUIRES_ARGUMENT(
            "function '%s' requires at least one argument",
            "関数 '%s' には少なくとも1つの引数が必要です"),
    ARGUMENT_COUNT(
            "function '%s' expects %d argument(s), got %d",
            "関数 '%s' は %d 個の引数を受け取りますが、%d 個が渡されました"),
    UNUSED_EXPRESSION(
            "expression result is not used",
            "式の結果が使用されていません"),
    NESTED_DECLARATION(
            "'%s' is only allowed at the top level",
            "'%s' はトップレベルでのみ使用できます"),
    MAIN_PARAMETERS(
            "function 'main' must not declare parameters",
            "関数 'main' は引数を宣言できません"),
    DUPLICATE_FUNCTION(
            "function '%s' is already defined",
            "関数 '%s' は既に定義されています"),
    DUPLICATE_VARIABLE(
            "variable '%s' is already declared in this scope",
            "変数 '%s' はこのスコープで既に宣言されています"),
    VOID_CALL_VALUE(
            "function '%s' does not return a value",
            "関数 '%s' は値を返しません"),
    MISSING_RETURN(
            "function '%s' must return a value on every path",
            "関数 '%s' はすべての経路で値を返す必要があります"),
    ENDLESS_INITIALIZER(
            "top-level statements of a module must run to completion",
            "モジュールのトップレベル文は最後まで実行される必要があります");

    private final String primary;
    private final String secondary;

    Messages(String primary, String secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    public String primary(Object... args) {
        return String.format(primary, args);
    }

    public String secondary(Object... args) {
        return String.format(secondary, args);
    }
}
