package com.vtb.auditor.catalog;

import com.vtb.auditor.chain.Instruction;

@FunctionalInterface
public interface InstructionBuilder {

    /**
     * @throws com.vtb.auditor.chain.InstructionBuildException если аккаунт или аргумент не разрешается
     */
    Instruction build(BuildContext context, InstructionArgs args);
}
