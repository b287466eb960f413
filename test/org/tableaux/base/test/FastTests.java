package org.tableaux.base.test;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({BranchTest.class,
                     LexicalTest.class,
                     LogicTest.class,
                     PolishParserTest.class,
                     PredicatesTest.class,
                     TableauConfigurationTest.class,
                     TableauTest.class,
                     WatchdogTest.class})
public class FastTests
{

}
