package com.storielang.compiler;

/**
 * 脚本错误分类
 */
public enum ErrorKind {
    /** 非法字符、缩进不一致、未闭合字符串 */
    LEXICAL,
    /** 缺少或意外的 token */
    SYNTAX,
    /** 未定义变量、调用非函数、操作数类型错误等 */
    RUNTIME
}
