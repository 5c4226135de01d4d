package com.example.campuseats.global.error.exception;

import lombok.Getter;

@Getter
public class BusinessException extends RuntimeException {

	private final ExceptionMessage exceptionMessage;
	private final String className;
	private final String methodName;
	private final int lineNumber;

	public BusinessException(ExceptionMessage exceptionMessage) {
		this(exceptionMessage, null);
	}

	public BusinessException(ExceptionMessage exceptionMessage, Throwable cause) {
		super(exceptionMessage.getMessage(), cause);
		this.exceptionMessage = exceptionMessage;

		StackTraceElement[] stack = Thread.currentThread().getStackTrace();
		StackTraceElement origin = locateOrigin(stack);
		this.className = origin.getClassName();
		this.methodName = origin.getMethodName();
		this.lineNumber = origin.getLineNumber();
	}

	public String extractExceptionLocation() {
		return String.format("[%s][%s][%d]: ", className, methodName, lineNumber);
	}

	// first frame outside the exception hierarchy's own constructors
	private static StackTraceElement locateOrigin(StackTraceElement[] stack) {
		for (int i = 2; i < stack.length; i++) {
			if (!"<init>".equals(stack[i].getMethodName())) {
				return stack[i];
			}
		}
		return stack[stack.length - 1];
	}
}
