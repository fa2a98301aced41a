package org.atoms.analogCompiler.compiler.errors;

import org.atoms.analogCompiler.compiler.IErrorReporter;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** A list of messages reported while compiling. */
public class CompilerMessages implements IErrorReporter {
    public static class Message {
        public final boolean warning;
        public final String errorType;
        public final String message;

        protected Message(boolean warning, String errorType, String message) {
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Message(BaseCompilerException e) {
            this(false, e.getErrorKind(), e.getMessage());
        }

        public void format(StringBuilder output) {
            if (this.warning)
                output.append("warning:");
            else
                output.append("error:");
            output.append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final List<Message> messages;
    public int exitCode = 0;

    public CompilerMessages() {
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
        this.exitCode = 0;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning)
            this.exitCode = 1;
    }

    @Override
    public void reportProblem(boolean warning, String errorType, String message) {
        this.reportError(new Message(warning, errorType, message));
    }

    public void reportError(BaseCompilerException e) {
        this.reportError(new Message(e));
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount() > 0;
    }

    public void show(PrintStream stream, boolean quiet) {
        for (Message message: this.messages) {
            if (quiet && message.warning)
                continue;
            stream.print(message);
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages)
            message.format(builder);
        return builder.toString();
    }
}
