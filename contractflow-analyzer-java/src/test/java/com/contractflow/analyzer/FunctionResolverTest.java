package com.contractflow.analyzer;

import com.contractflow.analyzer.callgraph.FunctionResolver;
import com.contractflow.analyzer.program.Contract;
import com.contractflow.analyzer.program.ContractKind;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.ProgramModel;
import org.junit.jupiter.api.Test;

import static com.contractflow.analyzer.TestPrograms.program;
import static org.junit.jupiter.api.Assertions.*;

class FunctionResolverTest {

    @Test
    void implementedFunctionIsReturnedAsIs() {
        TestPrograms.InterfaceImpl p = new TestPrograms.InterfaceImpl();
        FunctionResolver resolver = new FunctionResolver(p.program);
        assertSame(p.implFoo, resolver.resolve(p.implFoo));
    }

    @Test
    void interfaceFunctionResolvesToImplementation() {
        TestPrograms.InterfaceImpl p = new TestPrograms.InterfaceImpl();
        FunctionResolver resolver = new FunctionResolver(p.program);
        assertSame(p.implFoo, resolver.resolve(p.abstractFoo));
    }

    @Test
    void signatureMismatchIsSkipped() {
        Contract iface = new Contract("IToken", ContractKind.INTERFACE);
        Contract token = new Contract("Token", ContractKind.CONTRACT);
        Function wanted = iface.declareFunction("transfer", "transfer(address,uint256)", false);
        token.declareFunction("transfer", "transfer(address)", true);
        Function match = token.declareFunction("transfer", "transfer(address,uint256)", true);

        FunctionResolver resolver = new FunctionResolver(program(iface, token));
        assertSame(match, resolver.resolve(wanted));
    }

    @Test
    void missingSignatureAcceptsFirstNameMatch() {
        Contract iface = new Contract("IToken", ContractKind.INTERFACE);
        Contract first = new Contract("TokenA", ContractKind.CONTRACT);
        Contract second = new Contract("TokenB", ContractKind.CONTRACT);
        Function wanted = iface.declareFunction("mint", null, false);
        Function firstMint = first.declareFunction("mint", "mint(uint256)", true);
        second.declareFunction("mint", "mint(uint256)", true);

        FunctionResolver resolver = new FunctionResolver(program(iface, first, second));
        assertSame(firstMint, resolver.resolve(wanted));
    }

    @Test
    void noCandidateReturnsOriginal() {
        Contract iface = new Contract("IOracle", ContractKind.INTERFACE);
        Function price = iface.declareFunction("price", "price()", false);

        FunctionResolver resolver = new FunctionResolver(program(iface));
        assertSame(price, resolver.resolve(price));
    }

    @Test
    void interfaceContractsAreNeverCandidates() {
        Contract a = new Contract("IA", ContractKind.INTERFACE);
        Contract b = new Contract("IB", ContractKind.INTERFACE);
        Function wanted = a.declareFunction("ping", "ping()", false);
        // implemented flag on an interface member must not make it a candidate
        b.declareFunction("ping", "ping()", true);

        FunctionResolver resolver = new FunctionResolver(program(a, b));
        assertSame(wanted, resolver.resolve(wanted));
    }

    @Test
    void nullResolvesToNull() {
        FunctionResolver resolver = new FunctionResolver(ProgramModel.empty());
        assertNull(resolver.resolve(null));
    }
}
