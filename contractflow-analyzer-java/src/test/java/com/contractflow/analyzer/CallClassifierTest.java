package com.contractflow.analyzer;

import com.contractflow.analyzer.callgraph.CallClassifier;
import com.contractflow.analyzer.callgraph.CallKind;
import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.ContractKind;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Operation;
import com.contractflow.analyzer.program.OperationType;
import org.junit.jupiter.api.Test;

import static com.contractflow.analyzer.TestPrograms.*;
import static org.junit.jupiter.api.Assertions.*;

class CallClassifierTest {

    private final CallClassifier classifier = new CallClassifier();

    private final Contract token = new Contract("Token", ContractKind.CONTRACT);
    private final Contract math = new Contract("SafeMath", ContractKind.LIBRARY);
    private final Function transfer = token.declareFunction("transfer", "transfer(address,uint256)", true);
    private final Function add = math.declareFunction("add", "add(uint256,uint256)", true);

    @Test
    void internalCallToRegularContractIsInternal() {
        assertEquals(CallKind.INTERNAL, classifier.classify(internalCall(transfer)));
    }

    @Test
    void internalCallIntoLibraryIsLibrary() {
        assertEquals(CallKind.LIBRARY, classifier.classify(internalCall(add)));
    }

    @Test
    void libraryCallFormIsLibrary() {
        assertEquals(CallKind.LIBRARY, classifier.classify(libraryCall(add)));
    }

    @Test
    void highLevelCallIsHighLevel() {
        assertEquals(CallKind.HIGH_LEVEL, classifier.classify(highLevelCall(transfer)));
    }

    @Test
    void highLevelCallIntoLibraryIsLibrary() {
        assertEquals(CallKind.LIBRARY, classifier.classify(highLevelCall(add)));
    }

    @Test
    void lowLevelCallIsLowLevel() {
        assertEquals(CallKind.LOW_LEVEL, classifier.classify(lowLevelCall("dest.call(data)")));
    }

    @Test
    void lowLevelFormWithTargetStaysLowLevel() {
        Operation op = new Operation(OperationType.LOW_LEVEL_CALL, transfer, "dest.call(data)");
        assertEquals(CallKind.LOW_LEVEL, classifier.classify(op));
    }

    @Test
    void callWithoutTargetIsLowLevelNeverInternal() {
        assertEquals(CallKind.LOW_LEVEL,
                classifier.classify(new Operation(OperationType.INTERNAL_CALL, null, "f()")));
        assertEquals(CallKind.LOW_LEVEL,
                classifier.classify(new Operation(OperationType.HIGH_LEVEL_CALL, null, "x.f()")));
    }

    @Test
    void nonCallOperationHasNoKind() {
        assertNull(classifier.classify(other("a = b + 1")));
        assertNull(classifier.classify(null));
    }
}
