package org.symir.exceptions;

/**
 * 中间表示 (IR) 层所有类型化失败的公共父类。
 * 这些失败在检测点即不可恢复，直接传播给调用者，由外层工具决定如何处理。
 * @author Ayalyt
 */
public abstract class IrException extends RuntimeException {

    protected IrException(String message) {
        super(message);
    }
}
