package quark;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TypeTest {

  @Test
  public void mergeOfIdenticalTypesIsThatType() {
    assertThat(Type.merge(Type.intType(), Type.intType())).isEqualTo(Type.intType());
  }

  @Test
  public void mergeOfNothingIsVoid() {
    assertThat(Type.merge(ImmutableList.of())).isEqualTo(Type.voidType());
  }

  @Test
  public void anyPoisonsTheMerge() {
    assertThat(Type.merge(Type.intType(), Type.any(), Type.strType())).isEqualTo(Type.any());
    assertThat(Type.merge(Type.merge(Type.intType(), Type.strType()), Type.any()).isAny())
        .isTrue();
  }

  @Test
  public void unionsFlattenAndDeduplicate() {
    Type inner = Type.merge(Type.intType(), Type.strType());
    Type merged = Type.merge(inner, Type.boolType(), Type.intType());

    assertThat(merged).isInstanceOf(Type.UnionType.class);
    assertThat(((Type.UnionType) merged).options())
        .containsExactly(Type.boolType(), Type.intType(), Type.strType());
  }

  @Test
  public void unionDisplayIsOrderIndependent() {
    Type a = Type.merge(Type.strType(), Type.nullType(), Type.intType());
    Type b = Type.merge(Type.intType(), Type.strType(), Type.nullType());

    assertThat(a).isEqualTo(b);
    assertThat(a.toString()).isEqualTo("union[int | null | str]");
  }

  @Test
  public void containerDisplay() {
    assertThat(Type.listOf(Type.intType()).toString()).isEqualTo("list[int]");
    assertThat(Type.vectorOf(Type.floatType()).toString()).isEqualTo("vector[float]");
    assertThat(Type.dictOf(Type.strType(), Type.any()).toString()).isEqualTo("dict[str, any]");
    assertThat(Type.function(ImmutableList.of(Type.any(), Type.intType()), Type.boolType()).toString())
        .isEqualTo("fn(any, int) -> bool");
  }

  @Test
  public void numericPredicatesOnUnions() {
    Type number = Type.merge(Type.intType(), Type.floatType());

    assertThat(number.isNumeric()).isTrue();
    assertThat(number.isFloatLike()).isTrue();
    assertThat(number.isInteger()).isFalse();
    assertThat(Type.merge(Type.intType(), Type.strType()).isNumeric()).isFalse();
    assertThat(Type.merge(Type.intType(), Type.strType()).isComparable()).isTrue();
  }

  @Test
  public void accepts() {
    assertThat(Type.floatType().accepts(Type.intType())).isTrue();
    assertThat(Type.intType().accepts(Type.floatType())).isFalse();
    assertThat(Type.strType().accepts(Type.any())).isTrue();
    assertThat(Type.any().accepts(Type.strType())).isTrue();
    assertThat(Type.listOf(Type.any()).accepts(Type.listOf(Type.intType()))).isTrue();
    assertThat(Type.vectorOf(Type.floatType()).accepts(Type.vectorOf(Type.intType()))).isTrue();
    assertThat(Type.listOf(Type.intType()).accepts(Type.vectorOf(Type.intType()))).isFalse();
    assertThat(Type.merge(Type.intType(), Type.strType()).accepts(Type.strType())).isTrue();
    assertThat(Type.merge(Type.intType(), Type.strType()).accepts(Type.boolType())).isFalse();
  }

  @Test
  public void namedTypes() {
    assertThat(Type.named("int")).hasValue(Type.intType());
    assertThat(Type.named("list")).hasValue(Type.listOf(Type.any()));
    assertThat(Type.named("dict")).hasValue(Type.dictOf(Type.strType(), Type.any()));
    assertThat(Type.named("widget")).isEmpty();
  }
}
